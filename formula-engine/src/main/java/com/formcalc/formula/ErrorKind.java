package com.formcalc.formula;

/**
 * Kinds of failure a formula can produce while being tokenized, parsed,
 * ordered, evaluated or coerced.
 */
public enum ErrorKind {
    SYNTAX,
    UNDEFINED_FIELD,
    TYPE_MISMATCH,
    DIVISION_BY_ZERO,
    ARITHMETIC,
    UNKNOWN_FUNCTION,
    FUNCTION_ARGUMENT,
    CIRCULAR_DEPENDENCY,
    COERCION
}
