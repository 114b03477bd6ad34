package com.formcalc.formula;

import java.time.Clock;
import java.time.LocalDateTime;

public class DateFunctions {

    /**
     * @param clock source of the current time for {@code now()}
     */
    public static void register(FunctionRegistry registry, Clock clock) {
        registry.register("now",
                new BaseFunction("now", ResultType.TEXT, 0, 0,
                        args -> FormulaValue.of(LocalDateTime.now(clock).toString())));

        registry.register("today",
                new BaseFunction("today", ResultType.TEXT, 0, 0,
                        args -> FormulaValue.of(LocalDateTime.now(clock).toLocalDate().toString())));
    }
}
