package com.formcalc.formula;

import java.util.List;
import java.util.function.UnaryOperator;

public class TextFunctions {

    public static void register(FunctionRegistry registry) {
        registry.register("upper", textFunction("upper", String::toUpperCase), "toUpper");
        registry.register("lower", textFunction("lower", String::toLowerCase), "toLower");
        registry.register("strip", textFunction("strip", String::strip), "trim");

        registry.register("concat",
                new BaseFunction("concat", ResultType.TEXT, 0, BaseFunction.VARIADIC, args -> {
                    StringBuilder sb = new StringBuilder();
                    for (FormulaValue arg : args) {
                        sb.append(arg.render());
                    }
                    return FormulaValue.of(sb.toString());
                }), "append");

        registry.register("len",
                new BaseFunction("len", ResultType.NUMBER, 1, 1, args -> {
                    FormulaValue value = args.get(0);
                    if (value.isNull()) return FormulaValue.of(0L);
                    if (!value.isText()) {
                        throw FormulaException.argument("len", "argument 1 must be TEXT, got " + value.getType());
                    }
                    String s = value.asText();
                    return FormulaValue.of((long) s.codePointCount(0, s.length()));
                }), "length");
    }

    // null passes through, other non-text values are rendered first
    private static BaseFunction textFunction(String name, UnaryOperator<String> op) {
        return new BaseFunction(name, ResultType.TEXT, 1, 1, (List<FormulaValue> args) -> {
            FormulaValue value = args.get(0);
            if (value.isNull()) {
                return FormulaValue.NULL;
            }
            return FormulaValue.of(op.apply(value.render()));
        });
    }
}
