package com.formcalc.formula;

public class LogicalFunctions {

    public static void register(FunctionRegistry registry) {
        // arguments are evaluated eagerly, so both branches must evaluate
        registry.register("if_else",
                new BaseFunction("if_else", ResultType.UNKNOWN, 3, 3,
                        args -> args.get(0).isTruthy() ? args.get(1) : args.get(2)), "if");

        registry.register("is_empty",
                new BaseFunction("is_empty", ResultType.BOOLEAN, 1, 1, args -> {
                    FormulaValue value = args.get(0);
                    return FormulaValue.of(value.isNull() || (value.isText() && value.asText().isBlank()));
                }), "isEmpty");

        registry.register("coalesce",
                new BaseFunction("coalesce", ResultType.UNKNOWN, 0, BaseFunction.VARIADIC, args -> {
                    for (FormulaValue arg : args) {
                        if (!arg.isNull()) return arg;
                    }
                    return FormulaValue.NULL;
                }));
    }
}
