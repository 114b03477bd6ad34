package com.formcalc.formula;

import java.util.Objects;

/**
 * How a field's value is rendered for a generated document: a formula and the target it must be coerced to.
 */
public final class OutputMapping {

    private final OutputTarget target;
    private final String formulaText;

    public OutputMapping(OutputTarget target, String formulaText) {
        this.target = Objects.requireNonNull(target, "target");
        if (formulaText == null || formulaText.isBlank()) {
            throw new IllegalArgumentException("Output mapping formula must not be empty");
        }
        this.formulaText = formulaText;
    }

    public OutputTarget getTarget() {
        return target;
    }

    public String getFormulaText() {
        return formulaText;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OutputMapping other && target == other.target && formulaText.equals(other.formulaText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, formulaText);
    }

    @Override
    public String toString() {
        return target + ": " + formulaText;
    }
}
