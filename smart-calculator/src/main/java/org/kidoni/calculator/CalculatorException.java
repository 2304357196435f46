package org.kidoni.calculator;

public class CalculatorException extends RuntimeException {
    private final ErrorKind kind;

    public CalculatorException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public static CalculatorException invalidExpression(final String message) {
        return new CalculatorException(ErrorKind.INVALID_EXPRESSION, message);
    }

    public static CalculatorException unknownVariable(final String name) {
        return new CalculatorException(ErrorKind.UNKNOWN_VARIABLE, "Unknown variable " + name);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
