package com.formcalc.formula;

/**
 * Numeric operator semantics shared by the evaluator and the numeric functions.
 * Integral operands give integral results for + - * % and non-negative powers;
 * division always gives a decimal.
 */
final class Arithmetic {

    private Arithmetic() {
    }

    static FormulaValue add(FormulaValue a, FormulaValue b) {
        if (bothIntegral(a, b)) {
            try {
                return FormulaValue.of(Math.addExact(toLong(a), toLong(b)));
            } catch (ArithmeticException overflow) {
                return finite("+", a.asNumber() + b.asNumber());
            }
        }
        return finite("+", a.asNumber() + b.asNumber());
    }

    static FormulaValue subtract(FormulaValue a, FormulaValue b) {
        if (bothIntegral(a, b)) {
            try {
                return FormulaValue.of(Math.subtractExact(toLong(a), toLong(b)));
            } catch (ArithmeticException overflow) {
                return finite("-", a.asNumber() - b.asNumber());
            }
        }
        return finite("-", a.asNumber() - b.asNumber());
    }

    static FormulaValue multiply(FormulaValue a, FormulaValue b) {
        if (bothIntegral(a, b)) {
            try {
                return FormulaValue.of(Math.multiplyExact(toLong(a), toLong(b)));
            } catch (ArithmeticException overflow) {
                return finite("*", a.asNumber() * b.asNumber());
            }
        }
        return finite("*", a.asNumber() * b.asNumber());
    }

    static FormulaValue divide(FormulaValue a, FormulaValue b) {
        if (b.asNumber() == 0.0) {
            throw new FormulaException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
        }
        return finite("/", a.asNumber() / b.asNumber());
    }

    /**
     * Floored modulo: the result takes the sign of the divisor.
     */
    static FormulaValue modulo(FormulaValue a, FormulaValue b) {
        if (b.asNumber() == 0.0) {
            throw new FormulaException(ErrorKind.DIVISION_BY_ZERO, "Modulo by zero");
        }
        if (bothIntegral(a, b)) {
            return FormulaValue.of(Math.floorMod(toLong(a), toLong(b)));
        }
        double x = a.asNumber();
        double y = b.asNumber();
        double r = x % y;
        if (r != 0.0 && (r < 0) != (y < 0)) {
            r += y;
        }
        return finite("%", r);
    }

    static FormulaValue power(FormulaValue base, FormulaValue exponent) {
        double b = base.asNumber();
        double e = exponent.asNumber();
        if (b == 0.0 && e < 0) {
            throw new FormulaException(ErrorKind.DIVISION_BY_ZERO, "Zero cannot be raised to a negative power");
        }
        if (bothIntegral(base, exponent) && e >= 0) {
            try {
                return FormulaValue.of(exactPower(toLong(base), toLong(exponent)));
            } catch (ArithmeticException overflow) {
                return finite("**", Math.pow(b, e));
            }
        }
        return finite("**", Math.pow(b, e));
    }

    static FormulaValue negate(FormulaValue value) {
        if (value.isIntegral() && value.asLong() != Long.MIN_VALUE) {
            return FormulaValue.of(-toLong(value));
        }
        return FormulaValue.of(-value.asNumber());
    }

    static int compare(FormulaValue a, FormulaValue b) {
        if (a.isNumber()) {
            return FormulaValue.compareNumbers(a, b);
        }
        return compareCodePoints(a.asText(), b.asText());
    }

    /**
     * Lexicographic order by Unicode code point, so characters outside the BMP
     * sort after every BMP character.
     */
    static int compareCodePoints(String x, String y) {
        int i = 0;
        int j = 0;
        while (i < x.length() && j < y.length()) {
            int cx = x.codePointAt(i);
            int cy = y.codePointAt(j);
            if (cx != cy) {
                return Integer.compare(cx, cy);
            }
            i += Character.charCount(cx);
            j += Character.charCount(cy);
        }
        return Boolean.compare(i < x.length(), j < y.length());
    }

    // square-and-multiply; throws ArithmeticException when the result leaves the long range
    private static long exactPower(long base, long exponent) {
        long result = 1;
        long factor = base;
        long e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = Math.multiplyExact(result, factor);
            }
            e >>= 1;
            if (e > 0) {
                factor = Math.multiplyExact(factor, factor);
            }
        }
        return result;
    }

    private static FormulaValue finite(String operator, double result) {
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new FormulaException(ErrorKind.ARITHMETIC, "Result of " + operator + " is not a finite number");
        }
        return FormulaValue.of(result);
    }

    private static boolean bothIntegral(FormulaValue a, FormulaValue b) {
        return a.isIntegral() && b.isIntegral();
    }

    private static long toLong(FormulaValue value) {
        return value.asLong();
    }
}
