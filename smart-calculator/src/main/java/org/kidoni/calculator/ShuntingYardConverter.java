package org.kidoni.calculator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts an infix token sequence to postfix (reverse Polish) order with an operator stack.
 * Operators of equal priority are left associative, so {@code 10 - 2 - 3} becomes {@code 10 2 - 3 -}.
 */
public final class ShuntingYardConverter {
    private static final Logger LOG = LoggerFactory.getLogger(ShuntingYardConverter.class);

    private final List<Token> postfix = new ArrayList<>();
    private final Deque<Token> operators = new ArrayDeque<>();

    private ShuntingYardConverter() {
    }

    /**
     * @return the postfix sequence, free of parentheses
     * @throws CalculatorException of kind {@link ErrorKind#INVALID_EXPRESSION} on unmatched parentheses
     */
    public static List<Token> toPostfix(final List<Token> infix) {
        final ShuntingYardConverter converter = new ShuntingYardConverter();
        infix.forEach(converter::accept);
        converter.drain();

        LOG.debug("postfix: {}", converter.postfix);
        return List.copyOf(converter.postfix);
    }

    private void accept(final Token current) {
        if (current instanceof Token.NumberToken || current instanceof Token.IdentifierToken) {
            postfix.add(current);
        }
        else if (current instanceof Token.RightParen) {
            closeParenthesis();
        }
        else if (operators.isEmpty() || operators.peek() instanceof Token.LeftParen) {
            operators.push(current);
        }
        else if (current instanceof Token.LeftParen) {
            operators.push(current);
        }
        else if (current.priority() > operators.peek().priority()) {
            operators.push(current);
        }
        else {
            while (!operators.isEmpty()
                    && !(operators.peek() instanceof Token.LeftParen)
                    && operators.peek().priority() >= current.priority()) {
                postfix.add(operators.pop());
            }
            operators.push(current);
        }
    }

    private void closeParenthesis() {
        while (true) {
            if (operators.isEmpty()) {
                throw CalculatorException.invalidExpression("Right brace without left brace");
            }
            final Token top = operators.pop();
            if (top instanceof Token.LeftParen) {
                return;
            }
            postfix.add(top);
        }
    }

    private void drain() {
        while (!operators.isEmpty()) {
            final Token top = operators.pop();
            if (top instanceof Token.LeftParen) {
                throw CalculatorException.invalidExpression("Left brace without right brace");
            }
            postfix.add(top);
        }
    }
}
