package com.formcalc.formula;

/**
 * Representation a computed value must take when written to a generated document.
 */
public enum OutputTarget {
    TEXT,
    NUMBER,
    BOOLEAN;

    /**
     * @throws IllegalArgumentException for an unknown target name
     */
    public static OutputTarget parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output target must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output target: " + name, e);
        }
    }
}
