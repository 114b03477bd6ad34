package com.formcalc.formula;

import java.time.Clock;
import java.util.*;

/**
 * Functions available to formulas, looked up case-insensitively by name or alias.
 */
public class FunctionRegistry {

    private final Map<String, FormulaFunction> functions = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    /**
     * Registry with every built-in function, {@code now()} reading the given clock.
     */
    public static FunctionRegistry withBuiltins(Clock clock) {
        FunctionRegistry registry = new FunctionRegistry();
        NumericFunctions.register(registry);
        TextFunctions.register(registry);
        LogicalFunctions.register(registry);
        DateFunctions.register(registry, clock);
        return registry;
    }

    public static FunctionRegistry withBuiltins() {
        return withBuiltins(Clock.systemDefaultZone());
    }

    public void register(String name, FormulaFunction function, String... alternativeNames) {
        String key = name.toLowerCase();
        functions.put(key, function);
        for (String alias : alternativeNames) {
            aliases.put(alias.toLowerCase(), key);
        }
    }

    public FormulaFunction get(String name) {
        return functions.get(resolve(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(resolve(name));
    }

    /**
     * Registered primary names, sorted.
     */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(functions.keySet()));
    }

    private String resolve(String name) {
        String lower = name.toLowerCase();
        return aliases.getOrDefault(lower, lower);
    }
}
