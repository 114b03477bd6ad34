package com.formcalc.formula;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field of an entity as far as the formula engine is concerned: its id, the formula
 * that calculates it (absent for user-entered fields) and its output mappings.
 */
public final class FieldDefinition {

    private final String id;
    private final String formula;
    private final List<OutputMapping> outputs;

    public FieldDefinition(String id, String formula, List<OutputMapping> outputs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Field id must not be empty");
        }
        this.id = id;
        this.formula = formula;
        this.outputs = List.copyOf(outputs);
    }

    public static FieldDefinition calculated(String id, String formula) {
        return new FieldDefinition(id, Objects.requireNonNull(formula, "formula"), List.of());
    }

    public String getId() {
        return id;
    }

    public Optional<String> getFormula() {
        return Optional.ofNullable(formula);
    }

    public boolean isCalculated() {
        return formula != null;
    }

    public List<OutputMapping> getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return id + (formula != null ? " = " + formula : "");
    }
}
