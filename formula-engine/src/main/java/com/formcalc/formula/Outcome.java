package com.formcalc.formula;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a fallible formula operation: either a value or a {@link FormulaError}.
 *
 * @param <T> type of the successful value
 */
public final class Outcome<T> {

    private final T value;
    private final FormulaError error;

    private Outcome(T value, FormulaError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(FormulaError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return failure(FormulaError.of(kind, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present, failed with " + error);
        }
        return value;
    }

    public FormulaError getError() {
        if (error == null) {
            throw new NoSuchElementException("No error present");
        }
        return error;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
