package com.formcalc.formula;

import java.util.Objects;

/**
 * A value coerced to the target of the output mapping that produced it.
 */
public final class OutputValue {

    private final OutputTarget target;
    private final FormulaValue value;

    public OutputValue(OutputTarget target, FormulaValue value) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public OutputTarget getTarget() {
        return target;
    }

    public FormulaValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OutputValue other && target == other.target && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value);
    }

    @Override
    public String toString() {
        return target + "(" + value + ")";
    }
}
