package com.formcalc.formula;

import com.formcalc.util.EngineConfig;
import com.formcalc.util.LoggingUtil;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the formula engine. Every operation reports formula problems through its
 * result; only programming errors such as null arguments surface as exceptions.
 */
public class FormulaService {

    private final EngineConfig config;
    private final FunctionRegistry registry;
    private final FormulaEvaluator evaluator;
    private final FormulaCache cache;
    private final OutputMappingEvaluator outputEvaluator;
    private final TypeInference typeInference;

    public FormulaService() {
        this(new EngineConfig(), FunctionRegistry.withBuiltins());
    }

    public FormulaService(EngineConfig config) {
        this(config, FunctionRegistry.withBuiltins());
    }

    public FormulaService(EngineConfig config, Clock clock) {
        this(config, FunctionRegistry.withBuiltins(clock));
    }

    public FormulaService(EngineConfig config, FunctionRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.evaluator = new FormulaEvaluator(registry);
        this.cache = new FormulaCache(config.isCacheFormulas(), config.getCacheSize());
        this.outputEvaluator = new OutputMappingEvaluator(evaluator, cache);
        this.typeInference = new TypeInference(registry);
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public Outcome<Formula> compile(String text) {
        try {
            return Outcome.success(cache.get(text));
        } catch (FormulaException e) {
            return Outcome.failure(e.getError());
        }
    }

    public Outcome<FormulaValue> evaluate(String text, FieldSnapshot snapshot) {
        return compile(text).flatMap(formula -> evaluate(formula, snapshot));
    }

    public Outcome<FormulaValue> evaluate(Formula formula, FieldSnapshot snapshot) {
        return evaluator.evaluate(formula.getAst(), snapshot);
    }

    /**
     * Names of the fields a formula reads. Blank text references nothing.
     */
    public Outcome<Set<String>> fieldReferences(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.success(Set.of());
        }
        return compile(text).map(Formula::getFieldReferences);
    }

    /**
     * Order in which the calculated fields must be evaluated. Fails when a formula
     * does not parse or the fields depend on each other in a cycle.
     */
    public Outcome<List<String>> evaluationOrder(Map<String, String> formulas) {
        return graphOf(formulas).flatMap(DependencyGraph::evaluationOrder);
    }

    public Outcome<List<CycleReport>> detectCycles(Map<String, String> formulas) {
        return graphOf(formulas).map(DependencyGraph::findAllCycles);
    }

    /**
     * Evaluate every calculated field against the snapshot, dependencies first.
     * A field that fails keeps its error and is left out of the snapshot, so fields
     * that read it fail as undefined; the other fields are still evaluated.
     * Only a dependency cycle fails the batch as a whole.
     */
    public Outcome<EntityEvaluation> evaluateEntity(Map<String, String> formulas, FieldSnapshot snapshot) {
        Map<String, Outcome<Formula>> compiled = new LinkedHashMap<>();
        Map<String, Set<String>> references = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            Outcome<Formula> formula = compile(entry.getValue());
            compiled.put(entry.getKey(), formula);
            references.put(entry.getKey(), formula.isSuccess() ? formula.getValue().getFieldReferences() : Set.of());
        }

        Outcome<List<String>> order = DependencyGraph.fromReferences(references).evaluationOrder();
        if (order.isFailure()) {
            return Outcome.failure(order.getError());
        }

        FieldSnapshot current = snapshot;
        Map<String, Outcome<FormulaValue>> results = new LinkedHashMap<>();
        for (String field : order.getValue()) {
            Outcome<FormulaValue> result = timed(field, compiled.get(field), current);
            results.put(field, result);
            if (result.isSuccess()) {
                current = current.with(field, result.getValue());
            } else {
                LoggingUtil.warn("Field '" + field + "' failed: " + result.getError());
                current = current.without(field);
            }
        }
        return Outcome.success(new EntityEvaluation(order.getValue(), results, current));
    }

    public Outcome<EntityEvaluation> evaluateEntity(EntityDefinition entity) {
        LoggingUtil.debug("Evaluating entity '" + entity.getId() + "'");
        return evaluateEntity(entity.getFormulas(), entity.getValues());
    }

    public Outcome<OutputValue> evaluateOutputs(String fieldId, List<OutputMapping> mappings, FieldSnapshot snapshot) {
        return outputEvaluator.evaluate(fieldId, mappings, snapshot);
    }

    /**
     * Output values of every field with mappings, computed over the snapshot that
     * already holds the entity's calculated values.
     */
    public Outcome<Map<String, OutputValue>> evaluateEntityOutputs(EntityDefinition entity, FieldSnapshot snapshot) {
        return outputEvaluator.evaluateEntity(entity, snapshot);
    }

    public FormulaValidation validate(String text, Set<String> knownFields) {
        return validate(text, knownFields, Map.of());
    }

    /**
     * Check that a formula parses, reads only known fields and calls only registered functions.
     */
    public FormulaValidation validate(String text, Set<String> knownFields, Map<String, ResultType> fieldTypes) {
        if (text == null || text.isBlank()) {
            return new FormulaValidation(List.of("Formula is empty"), Set.of(), ResultType.UNKNOWN);
        }
        Outcome<Formula> compiled = compile(text);
        if (compiled.isFailure()) {
            return new FormulaValidation(List.of(compiled.getError().getMessage()), Set.of(), ResultType.UNKNOWN);
        }

        Formula formula = compiled.getValue();
        List<String> errors = new ArrayList<>();
        for (String field : formula.getFieldReferences()) {
            if (!knownFields.contains(field)) {
                errors.add("Unknown field '" + field + "'");
            }
        }
        for (String function : ReferenceExtractor.functionNames(formula.getAst())) {
            if (!registry.contains(function)) {
                errors.add("Unknown function '" + function + "'");
            }
        }
        return new FormulaValidation(errors, formula.getFieldReferences(),
                typeInference.infer(formula.getAst(), fieldTypes));
    }

    public ResultType inferResultType(String text, Map<String, ResultType> fieldTypes) {
        Outcome<Formula> compiled = compile(text);
        if (compiled.isFailure()) {
            return ResultType.UNKNOWN;
        }
        return typeInference.infer(compiled.getValue().getAst(), fieldTypes);
    }

    public SortedSet<String> availableFunctions() {
        return registry.names();
    }

    private Outcome<DependencyGraph> graphOf(Map<String, String> formulas) {
        Map<String, FormulaNode> asts = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            Outcome<Formula> formula = compile(entry.getValue());
            if (formula.isFailure()) {
                FormulaError cause = formula.getError();
                return Outcome.failure(FormulaError.forFields(cause.getKind(),
                        "Formula of field '" + entry.getKey() + "' is invalid: " + cause.getMessage(),
                        List.of(entry.getKey())));
            }
            asts.put(entry.getKey(), formula.getValue().getAst());
        }
        return Outcome.success(DependencyGraph.build(asts));
    }

    private Outcome<FormulaValue> timed(String field, Outcome<Formula> formula, FieldSnapshot snapshot) {
        if (formula.isFailure()) {
            return Outcome.failure(formula.getError());
        }
        long start = System.nanoTime();
        Outcome<FormulaValue> result = evaluate(formula.getValue(), snapshot);
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        long budget = config.getFieldBudgetMillis();
        if (budget > 0 && elapsed > budget) {
            LoggingUtil.warn("Field '" + field + "' took " + elapsed + " ms, over the budget of " + budget + " ms");
        }
        LoggingUtil.debug(field + " = " + (result.isSuccess() ? result.getValue() : result.getError()));
        return result;
    }
}
