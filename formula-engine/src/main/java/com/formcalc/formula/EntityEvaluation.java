package com.formcalc.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating every calculated field of one entity: one result per field in
 * evaluation order, and the snapshot with every successfully computed value merged in.
 */
public final class EntityEvaluation {

    private final List<String> order;
    private final Map<String, Outcome<FormulaValue>> results;
    private final FieldSnapshot snapshot;

    EntityEvaluation(List<String> order, Map<String, Outcome<FormulaValue>> results, FieldSnapshot snapshot) {
        this.order = List.copyOf(order);
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.snapshot = snapshot;
    }

    public List<String> getOrder() {
        return order;
    }

    public Map<String, Outcome<FormulaValue>> getResults() {
        return results;
    }

    public Outcome<FormulaValue> getResult(String field) {
        Outcome<FormulaValue> result = results.get(field);
        if (result == null) {
            throw new IllegalArgumentException("Field '" + field + "' is not a calculated field of this entity");
        }
        return result;
    }

    public FieldSnapshot getSnapshot() {
        return snapshot;
    }

    public boolean isSuccess() {
        return results.values().stream().allMatch(Outcome::isSuccess);
    }

    /**
     * Errors of the fields that failed, in evaluation order.
     */
    public Map<String, FormulaError> getFailures() {
        Map<String, FormulaError> failures = new LinkedHashMap<>();
        results.forEach((field, result) -> {
            if (result.isFailure()) {
                failures.put(field, result.getError());
            }
        });
        return failures;
    }
}
