package com.formcalc.formula;

/**
 * Unchecked carrier for a {@link FormulaError}. Thrown inside the tokenizer, parser,
 * evaluator and functions; the public entry points turn it into an {@link Outcome}.
 */
public class FormulaException extends RuntimeException {

    private final FormulaError error;

    public FormulaException(FormulaError error) {
        super(error.getMessage());
        this.error = error;
    }

    public FormulaException(ErrorKind kind, String message) {
        this(FormulaError.of(kind, message));
    }

    public FormulaError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }

    public static FormulaException syntax(String message, int position) {
        return new FormulaException(FormulaError.at(ErrorKind.SYNTAX, message, position));
    }

    public static FormulaException argument(String function, String message) {
        return new FormulaException(ErrorKind.FUNCTION_ARGUMENT, function + "(): " + message);
    }
}
