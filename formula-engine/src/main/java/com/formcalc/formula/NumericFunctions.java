package com.formcalc.formula;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

public class NumericFunctions {

    public static void register(FunctionRegistry registry) {
        registry.register("abs",
                new BaseFunction("abs", ResultType.NUMBER, 1, 1, args -> {
                    if (args.get(0).isNull()) return FormulaValue.NULL;
                    FormulaValue x = BaseFunction.requireNumber("abs", args, 0);
                    return x.asNumber() < 0 ? Arithmetic.negate(x) : x;
                }));

        registry.register("min",
                new BaseFunction("min", ResultType.NUMBER, 1, BaseFunction.VARIADIC,
                        args -> extreme("min", args, -1)));

        registry.register("max",
                new BaseFunction("max", ResultType.NUMBER, 1, BaseFunction.VARIADIC,
                        args -> extreme("max", args, 1)));

        registry.register("round",
                new BaseFunction("round", ResultType.NUMBER, 1, 2, NumericFunctions::round));

        registry.register("sum",
                new BaseFunction("sum", ResultType.NUMBER, 0, BaseFunction.VARIADIC, args -> {
                    FormulaValue total = FormulaValue.of(0L);
                    for (int i = 0; i < args.size(); i++) {
                        if (args.get(i).isNull()) continue;
                        total = Arithmetic.add(total, BaseFunction.requireNumber("sum", args, i));
                    }
                    return total;
                }));

        registry.register("pow",
                new BaseFunction("pow", ResultType.NUMBER, 2, 2, args -> {
                    if (args.get(0).isNull() || args.get(1).isNull()) return FormulaValue.NULL;
                    return Arithmetic.power(BaseFunction.requireNumber("pow", args, 0),
                            BaseFunction.requireNumber("pow", args, 1));
                }), "power");
    }

    /**
     * Smallest (direction -1) or largest (direction 1) non-null argument; the first wins a tie.
     * Arguments must be all numbers or all text.
     */
    private static FormulaValue extreme(String function, List<FormulaValue> args, int direction) {
        List<FormulaValue> present = new ArrayList<>();
        for (FormulaValue arg : args) {
            if (!arg.isNull()) present.add(arg);
        }
        if (present.isEmpty()) {
            return FormulaValue.NULL;
        }

        ValueType type = present.get(0).getType();
        if (type != ValueType.NUMBER && type != ValueType.TEXT) {
            throw FormulaException.argument(function, "arguments must be NUMBER or TEXT, got " + type);
        }

        FormulaValue best = present.get(0);
        for (FormulaValue candidate : present) {
            if (candidate.getType() != type) {
                throw FormulaException.argument(function, "cannot compare " + type + " with " + candidate.getType());
            }
            if (Arithmetic.compare(candidate, best) * direction > 0) {
                best = candidate;
            }
        }
        return best;
    }

    // beyond this a double has no digits left to round
    static final int MAX_ROUND_DIGITS = 340;

    private static final BigDecimal MIN_LONG = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_LONG = BigDecimal.valueOf(Long.MAX_VALUE);

    // half-even on the exact binary value of the number
    private static FormulaValue round(List<FormulaValue> args) {
        if (args.get(0).isNull()) {
            return FormulaValue.NULL;
        }
        FormulaValue x = BaseFunction.requireNumber("round", args, 0);
        int digits = 0;
        if (args.size() > 1) {
            FormulaValue d = BaseFunction.requireNumber("round", args, 1);
            if (!d.isIntegral()) {
                throw FormulaException.argument("round", "digits must be an integer, got " + d);
            }
            if (d.asLong() < -MAX_ROUND_DIGITS || d.asLong() > MAX_ROUND_DIGITS) {
                throw FormulaException.argument("round",
                        "digits must be between -" + MAX_ROUND_DIGITS + " and " + MAX_ROUND_DIGITS + ", got " + d);
            }
            digits = (int) d.asLong();
        }

        BigDecimal exact = x.isIntegral() ? BigDecimal.valueOf(x.asLong()) : new BigDecimal(x.asNumber());
        BigDecimal rounded = exact.setScale(digits, RoundingMode.HALF_EVEN);
        if ((args.size() == 1 || x.isIntegral()) && fitsLong(rounded)) {
            return FormulaValue.of(rounded.longValueExact());
        }
        return FormulaValue.of(rounded.doubleValue());
    }

    private static boolean fitsLong(BigDecimal value) {
        return value.compareTo(MIN_LONG) >= 0 && value.compareTo(MAX_LONG) <= 0;
    }
}
