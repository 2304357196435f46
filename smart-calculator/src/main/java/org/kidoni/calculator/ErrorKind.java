package org.kidoni.calculator;

/**
 * Kinds of failure the calculator reports. Each kind carries the text shown to the user.
 */
public enum ErrorKind {
    INVALID_EXPRESSION("Invalid expression"),
    UNKNOWN_VARIABLE("Unknown variable"),
    INVALID_ASSIGNMENT("Invalid assignment"),
    INVALID_IDENTIFIER("Invalid identifier"),
    DIVISION_BY_ZERO("Division by zero"),
    UNKNOWN_COMMAND("Unknown command");

    private final String message;

    ErrorKind(final String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
