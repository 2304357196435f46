package org.kidoni.calculator;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a postfix token sequence with an operand stack. Variables are read from a {@link VariableStore}
 * and never written.
 */
public class PostfixEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(PostfixEvaluator.class);

    private final VariableStore store;
    private final boolean strict;

    public PostfixEvaluator(final VariableStore store) {
        this(store, true);
    }

    /**
     * @param strict when {@code true} more than one operand left on the stack is an invalid expression,
     *               otherwise the bottom operand is the result
     */
    public PostfixEvaluator(final VariableStore store, final boolean strict) {
        assert store != null;
        this.store = store;
        this.strict = strict;
    }

    public BigInteger evaluate(final List<Token> postfix) {
        final Deque<BigInteger> operands = new ArrayDeque<>();

        for (Token token : postfix) {
            if (token instanceof Token.NumberToken number) {
                operands.push(number.value());
            }
            else if (token instanceof Token.IdentifierToken identifier) {
                operands.push(store.get(identifier.name()));
            }
            else if (token instanceof Token.OperatorToken operator) {
                if (operands.size() < 2) {
                    throw CalculatorException.invalidExpression("Too many signs in expression");
                }
                final BigInteger rhs = operands.pop();
                final BigInteger lhs = operands.pop();
                operands.push(apply(operator.operator(), lhs, rhs));
            }
            else {
                throw CalculatorException.invalidExpression("Unexpected " + token + " in postfix expression");
            }
        }

        if (operands.isEmpty()) {
            throw CalculatorException.invalidExpression("Empty expression");
        }
        if (operands.size() > 1) {
            if (strict) {
                throw CalculatorException.invalidExpression("Too many operands in expression");
            }
            LOG.debug("{} operands left, using the first one", operands.size());
        }

        return operands.peekLast();
    }

    private static BigInteger apply(final Operator operator, final BigInteger lhs, final BigInteger rhs) {
        return switch (operator) {
            case PLUS -> lhs.add(rhs);
            case MINUS -> lhs.subtract(rhs);
            case MULTIPLY -> lhs.multiply(rhs);
            case DIVIDE -> {
                if (rhs.signum() == 0) {
                    throw new CalculatorException(ErrorKind.DIVISION_BY_ZERO, "Division of " + lhs + " by zero");
                }
                yield lhs.divide(rhs);
            }
        };
    }
}
