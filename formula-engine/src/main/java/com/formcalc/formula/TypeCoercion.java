package com.formcalc.formula;

/**
 * Strict conversion of evaluated values into output targets.
 * TEXT and BOOLEAN always succeed; NUMBER accepts numbers only, never booleans,
 * numeric-looking text or null.
 */
public final class TypeCoercion {

    private TypeCoercion() {
    }

    public static Outcome<FormulaValue> coerce(FormulaValue value, OutputTarget target) {
        switch (target) {
            case TEXT:
                return Outcome.success(FormulaValue.of(value.render()));
            case BOOLEAN:
                return Outcome.success(FormulaValue.of(value.isTruthy()));
            case NUMBER:
                if (value.isNumber()) {
                    return Outcome.success(FormulaValue.of(value.asNumber()));
                }
                return Outcome.failure(ErrorKind.COERCION,
                        "Cannot convert " + value.getType() + " to NUMBER");
            default:
                throw new IllegalArgumentException("Unsupported output target: " + target);
        }
    }
}
