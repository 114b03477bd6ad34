package com.formcalc.formula;

import java.util.Objects;

/**
 * Tagged runtime value of the formula language: a number, text, boolean or null.
 * Numbers remember whether they are integral so that {@code 5} and {@code 15.0}
 * render the way they were written or computed. Integral numbers hold a {@code long}
 * and keep full 64-bit precision; decimals hold a {@code double}.
 */
public final class FormulaValue {

    public static final FormulaValue NULL = new FormulaValue(ValueType.NULL, null, false);
    public static final FormulaValue TRUE = new FormulaValue(ValueType.BOOLEAN, Boolean.TRUE, false);
    public static final FormulaValue FALSE = new FormulaValue(ValueType.BOOLEAN, Boolean.FALSE, false);

    private final ValueType type;
    private final Object value;
    private final boolean integral;

    private FormulaValue(ValueType type, Object value, boolean integral) {
        this.type = type;
        this.value = value;
        this.integral = integral;
    }

    public static FormulaValue of(long number) {
        return new FormulaValue(ValueType.NUMBER, number, true);
    }

    public static FormulaValue of(double number) {
        return new FormulaValue(ValueType.NUMBER, number, false);
    }

    public static FormulaValue of(String text) {
        if (text == null) {
            return NULL;
        }
        return new FormulaValue(ValueType.TEXT, text, false);
    }

    public static FormulaValue of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    /**
     * Convert a plain Java value (as found in a JSON document or a UI model) into a formula value.
     * Integer types become integral numbers, floating point types decimal ones.
     *
     * @throws IllegalArgumentException for types the formula language has no counterpart for
     */
    public static FormulaValue from(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof FormulaValue v) return v;
        if (raw instanceof Boolean b) return of(b.booleanValue());
        if (raw instanceof String s) return of(s);
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof Number n) return of(n.doubleValue());
        throw new IllegalArgumentException("Unsupported field value type: " + raw.getClass().getName());
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    /**
     * True for numbers that came from an integer literal or integral arithmetic.
     */
    public boolean isIntegral() {
        return integral;
    }

    public double asNumber() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return ((Number) value).doubleValue();
    }

    /**
     * Exact value of an integral number.
     */
    public long asLong() {
        if (type != ValueType.NUMBER || !integral) {
            throw new IllegalStateException("Not an integral number: " + this);
        }
        return (Long) value;
    }

    public String asText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Not text: " + this);
        }
        return (String) value;
    }

    public boolean asBoolean() {
        if (type != ValueType.BOOLEAN) {
            throw new IllegalStateException("Not a boolean: " + this);
        }
        return (Boolean) value;
    }

    /**
     * Truthiness used by {@code and}, {@code or}, {@code not} and BOOLEAN coercion:
     * null, false, zero and empty text are falsy.
     */
    public boolean isTruthy() {
        return switch (type) {
            case NULL -> false;
            case BOOLEAN -> (Boolean) value;
            case NUMBER -> integral ? (Long) value != 0L : (Double) value != 0.0;
            case TEXT -> !((String) value).isEmpty();
        };
    }

    /**
     * Plain Java representation: Long or Double for numbers, String, Boolean or null.
     */
    public Object toJava() {
        return value;
    }

    /**
     * Textual rendering used by TEXT coercion and text functions; null renders as empty text.
     */
    public String render() {
        return switch (type) {
            case NULL -> "";
            case TEXT -> (String) value;
            case BOOLEAN -> value.toString();
            case NUMBER -> value.toString();
        };
    }

    /**
     * Language equality: numbers compare by value regardless of integral flag,
     * values of different types are never equal.
     */
    public boolean sameAs(FormulaValue other) {
        if (type != other.type) {
            return false;
        }
        if (type == ValueType.NUMBER) {
            return compareNumbers(this, other) == 0;
        }
        return Objects.equals(value, other.value);
    }

    /**
     * Numeric ordering; exact when both numbers are integral.
     */
    static int compareNumbers(FormulaValue a, FormulaValue b) {
        if (a.integral && b.integral) {
            return Long.compare(a.asLong(), b.asLong());
        }
        double x = a.asNumber();
        double y = b.asNumber();
        return x < y ? -1 : (x > y ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaValue other)) return false;
        return type == other.type && integral == other.integral && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, integral);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NULL -> "null";
            case TEXT -> "\"" + value + "\"";
            default -> render();
        };
    }
}
