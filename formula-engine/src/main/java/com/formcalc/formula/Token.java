package com.formcalc.formula;

import java.util.Objects;

/**
 * A lexical token of a formula. The value is the literal for NUMBER/STRING tokens
 * (a {@link FormulaValue}), the name for identifiers, the source text for
 * operators and keywords, and null for EOF.
 */
public final class Token {

    private final TokenType type;
    private final Object value;
    private final int position;

    public Token(TokenType type, Object value, int position) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = value;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return position == other.position && type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, position);
    }

    @Override
    public String toString() {
        return "Token(" + type + ", " + value + ", pos=" + position + ")";
    }
}
