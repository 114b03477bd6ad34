package com.formcalc.formula;

/**
 * Semantic type of a {@link FormulaValue}.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    NULL
}
