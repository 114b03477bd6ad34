package com.formcalc.formula;

import com.formcalc.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates output mappings for document generation.
 * The mappings of a field are tried in declared order and the first one that both
 * evaluates and coerces wins; when none does, every attempt's error is reported together.
 */
public class OutputMappingEvaluator {

    private final FormulaEvaluator evaluator;
    private final FormulaCache cache;

    public OutputMappingEvaluator(FormulaEvaluator evaluator, FormulaCache cache) {
        this.evaluator = evaluator;
        this.cache = cache;
    }

    public Outcome<OutputValue> evaluate(String fieldId, List<OutputMapping> mappings, FieldSnapshot snapshot) {
        if (mappings.isEmpty()) {
            return Outcome.failure(ErrorKind.COERCION, "No output mapping defined for field '" + fieldId + "'");
        }

        List<FormulaError> errors = new ArrayList<>();
        for (OutputMapping mapping : mappings) {
            Outcome<OutputValue> attempt = attempt(mapping, snapshot);
            if (attempt.isSuccess()) {
                return attempt;
            }
            LoggingUtil.debug("Output mapping " + mapping + " of field '" + fieldId + "' failed: " + attempt.getError());
            errors.add(attempt.getError());
        }

        List<String> parts = new ArrayList<>();
        for (int i = 0; i < errors.size(); i++) {
            parts.add(mappings.get(i).getTarget() + ": " + errors.get(i).getMessage());
        }
        return Outcome.failure(FormulaError.aggregate(ErrorKind.COERCION,
                "All output mappings failed: " + String.join("; ", parts), errors));
    }

    /**
     * Evaluate the output mappings of every field of the entity. Fields without mappings
     * are skipped; the first field whose mappings all fail blocks the whole entity.
     *
     * @return field id to output value, in field declaration order
     */
    public Outcome<Map<String, OutputValue>> evaluateEntity(EntityDefinition entity, FieldSnapshot snapshot) {
        Map<String, OutputValue> outputs = new LinkedHashMap<>();
        for (FieldDefinition field : entity.getFields()) {
            if (field.getOutputs().isEmpty()) {
                continue;
            }
            Outcome<OutputValue> result = evaluate(field.getId(), field.getOutputs(), snapshot);
            if (result.isFailure()) {
                FormulaError cause = result.getError();
                return Outcome.failure(FormulaError.aggregate(cause.getKind(),
                        "Output mapping evaluation failed for field '" + field.getId() + "': " + cause.getMessage(),
                        List.of(cause)));
            }
            outputs.put(field.getId(), result.getValue());
        }
        return Outcome.success(Collections.unmodifiableMap(outputs));
    }

    private Outcome<OutputValue> attempt(OutputMapping mapping, FieldSnapshot snapshot) {
        Formula formula;
        try {
            formula = cache.get(mapping.getFormulaText());
        } catch (FormulaException e) {
            return Outcome.failure(e.getError());
        }
        return evaluator.evaluate(formula.getAst(), snapshot)
                .flatMap(value -> TypeCoercion.coerce(value, mapping.getTarget()))
                .map(coerced -> new OutputValue(mapping.getTarget(), coerced));
    }
}
