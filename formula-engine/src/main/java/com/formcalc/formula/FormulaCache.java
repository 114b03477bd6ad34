package com.formcalc.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled formulas keyed by their text, least recently used evicted first once
 * {@code maxEntries} is reached. Only successful compilations are kept; a syntax
 * error is raised again on every attempt. A disabled cache compiles on every call.
 */
public class FormulaCache {

    public static final int DEFAULT_MAX_ENTRIES = 1024;

    private final Map<String, Formula> compiled;
    private final boolean enabled;
    private final int maxEntries;

    public FormulaCache() {
        this(true);
    }

    public FormulaCache(boolean enabled) {
        this(enabled, DEFAULT_MAX_ENTRIES);
    }

    public FormulaCache(boolean enabled, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.enabled = enabled;
        this.maxEntries = maxEntries;
        this.compiled = Collections.synchronizedMap(new LinkedHashMap<String, Formula>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Formula> eldest) {
                return size() > FormulaCache.this.maxEntries;
            }
        });
    }

    /**
     * @throws FormulaException with kind SYNTAX
     */
    public Formula get(String text) {
        if (!enabled) {
            return Formula.compile(text);
        }
        Formula formula = compiled.get(text);
        if (formula == null) {
            // compile outside the lock; a concurrent miss on the same text keeps the first entry
            formula = Formula.compile(text);
            Formula existing = compiled.putIfAbsent(text, formula);
            if (existing != null) {
                formula = existing;
            }
        }
        return formula;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public int size() {
        return compiled.size();
    }

    public void clear() {
        compiled.clear();
    }
}
