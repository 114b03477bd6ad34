package com.formcalc.formula;

import java.util.List;
import java.util.Set;

/**
 * Design-time check of a formula against the fields and functions that exist.
 */
public final class FormulaValidation {

    private final List<String> errors;
    private final Set<String> fieldReferences;
    private final ResultType inferredType;

    FormulaValidation(List<String> errors, Set<String> fieldReferences, ResultType inferredType) {
        this.errors = List.copyOf(errors);
        this.fieldReferences = Set.copyOf(fieldReferences);
        this.inferredType = inferredType;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public Set<String> getFieldReferences() {
        return fieldReferences;
    }

    public ResultType getInferredType() {
        return inferredType;
    }

    @Override
    public String toString() {
        return isValid() ? "valid (" + inferredType + ")" : "invalid " + errors;
    }
}
