package com.formcalc.formula;

public enum TokenType {
    // literals
    NUMBER,
    STRING,
    TRUE,
    FALSE,
    NULL,

    IDENTIFIER,

    // arithmetic
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MODULO,
    POWER,

    // comparison
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_EQUAL,
    GREATER_THAN,
    GREATER_EQUAL,

    // logical
    AND,
    OR,
    NOT,

    LPAREN,
    RPAREN,
    COMMA,

    EOF
}
