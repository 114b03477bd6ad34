package com.formcalc.formula;

import java.util.List;
import java.util.function.Function;

public class BaseFunction implements FormulaFunction {

    public static final int VARIADIC = -1;

    private final String name;
    private final ResultType resultType;
    private final int minArgs;
    private final int maxArgs;
    private final Function<List<FormulaValue>, FormulaValue> implementation;

    public BaseFunction(String name,
                        ResultType resultType,
                        int minArgs,
                        int maxArgs,
                        Function<List<FormulaValue>, FormulaValue> implementation) {
        this.name = name;
        this.resultType = resultType;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.implementation = implementation;
    }

    public String getName() {
        return name;
    }

    @Override
    public ResultType getResultType() {
        return resultType;
    }

    @Override
    public int getMinArgs() {
        return minArgs;
    }

    @Override
    public int getMaxArgs() {
        return maxArgs;
    }

    @Override
    public FormulaValue apply(List<FormulaValue> args) {
        checkArity(args.size());
        return implementation.apply(args);
    }

    private void checkArity(int count) {
        if (count < minArgs) {
            throw FormulaException.argument(name, minArgs == maxArgs
                    ? "expects " + minArgs + " argument(s), got " + count
                    : "expects at least " + minArgs + " argument(s), got " + count);
        }
        if (maxArgs != VARIADIC && count > maxArgs) {
            throw FormulaException.argument(name, minArgs == maxArgs
                    ? "expects " + maxArgs + " argument(s), got " + count
                    : "expects at most " + maxArgs + " argument(s), got " + count);
        }
    }

    /**
     * Argument as a number, failing with FUNCTION_ARGUMENT for any other type.
     */
    protected static FormulaValue requireNumber(String function, List<FormulaValue> args, int index) {
        FormulaValue value = args.get(index);
        if (!value.isNumber()) {
            throw FormulaException.argument(function, "argument " + (index + 1)
                    + " must be NUMBER, got " + value.getType());
        }
        return value;
    }
}
