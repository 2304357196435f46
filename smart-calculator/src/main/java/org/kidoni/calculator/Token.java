package org.kidoni.calculator;

import java.math.BigInteger;
import java.util.regex.Pattern;

public sealed interface Token {
    Pattern NUMBER = Pattern.compile("-?\\d+");
    Pattern IDENTIFIER = Pattern.compile("[A-Za-z]+");

    static boolean isNumber(final String text) {
        return NUMBER.matcher(text).matches();
    }

    static boolean isIdentifier(final String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * Priority used by the operator stack. Parentheses report {@link Operator#PARENTHESIS_PRIORITY}.
     */
    default int priority() {
        return Operator.PARENTHESIS_PRIORITY;
    }

    record NumberToken(String literal) implements Token {
        public BigInteger value() {
            return new BigInteger(literal);
        }

        @Override
        public String toString() {
            return literal;
        }
    }

    record IdentifierToken(String name) implements Token {
        @Override
        public String toString() {
            return name;
        }
    }

    record OperatorToken(Operator operator) implements Token {
        @Override
        public int priority() {
            return operator.priority();
        }

        @Override
        public String toString() {
            return operator.toString();
        }
    }

    record LeftParen() implements Token {
        @Override
        public String toString() {
            return "(";
        }
    }

    record RightParen() implements Token {
        @Override
        public String toString() {
            return ")";
        }
    }
}
