package org.kidoni.calculator;

/**
 * Binary arithmetic operators. Higher priority binds tighter.
 */
public enum Operator {
    PLUS('+', 0),
    MINUS('-', 0),
    MULTIPLY('*', 1),
    DIVIDE('/', 1);

    /**
     * Priority of parentheses. Only stops precedence comparisons, never compared in order to pop.
     */
    public static final int PARENTHESIS_PRIORITY = 99;

    private final char sign;
    private final int priority;

    Operator(final char sign, final int priority) {
        this.sign = sign;
        this.priority = priority;
    }

    public char sign() {
        return sign;
    }

    public int priority() {
        return priority;
    }

    /**
     * Maps a sign character to a token: one of the operators, or a parenthesis.
     *
     * @throws CalculatorException if {@code sign} is not one of {@code + - * / ( )}
     */
    public static Token tokenOf(final char sign) {
        return switch (sign) {
            case '+' -> new Token.OperatorToken(PLUS);
            case '-' -> new Token.OperatorToken(MINUS);
            case '*' -> new Token.OperatorToken(MULTIPLY);
            case '/' -> new Token.OperatorToken(DIVIDE);
            case '(' -> new Token.LeftParen();
            case ')' -> new Token.RightParen();
            default -> throw CalculatorException.invalidExpression("Unknown operator " + sign);
        };
    }

    @Override
    public String toString() {
        return String.valueOf(sign);
    }
}
