package com.formcalc.formula;

/**
 * Statically inferred result type of a formula or function.
 */
public enum ResultType {
    NUMBER,
    TEXT,
    BOOLEAN,
    UNKNOWN
}
