package com.formcalc.formula;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of why a formula could not be parsed, ordered, evaluated or coerced.
 */
public final class FormulaError {

    public static final int NO_POSITION = -1;

    private final ErrorKind kind;
    private final String message;
    private final int position;
    private final List<String> fields;
    private final List<FormulaError> causes;

    private FormulaError(ErrorKind kind, String message, int position,
                         List<String> fields, List<FormulaError> causes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.position = position;
        this.fields = List.copyOf(fields);
        this.causes = List.copyOf(causes);
    }

    public static FormulaError of(ErrorKind kind, String message) {
        return new FormulaError(kind, message, NO_POSITION, List.of(), List.of());
    }

    public static FormulaError at(ErrorKind kind, String message, int position) {
        return new FormulaError(kind, message, position, List.of(), List.of());
    }

    public static FormulaError forFields(ErrorKind kind, String message, List<String> fields) {
        return new FormulaError(kind, message, NO_POSITION, fields, List.of());
    }

    public static FormulaError aggregate(ErrorKind kind, String message, List<FormulaError> causes) {
        return new FormulaError(kind, message, NO_POSITION, List.of(), causes);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Character offset in the formula text, or {@link #NO_POSITION}.
     */
    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }

    /**
     * Fields involved in the failure, e.g. the members of a dependency cycle.
     */
    public List<String> getFields() {
        return fields;
    }

    /**
     * Underlying failures of an aggregated error, in attempt order.
     */
    public List<FormulaError> getCauses() {
        return causes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaError other)) return false;
        return position == other.position
                && kind == other.kind
                && message.equals(other.message)
                && fields.equals(other.fields)
                && causes.equals(other.causes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, position, fields, causes);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
