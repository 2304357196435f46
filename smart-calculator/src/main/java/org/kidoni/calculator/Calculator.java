package org.kidoni.calculator;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates integer expressions such as {@code 8 * 3 + 12 * (4 - 2)} or {@code a -- b}.
 * <p>
 * A line goes through {@link SignNormalizer}, {@link Tokenizer}, {@link ShuntingYardConverter} and
 * {@link PostfixEvaluator}; nothing of it is kept once the line has been evaluated.
 */
public class Calculator {
    private static final Logger LOG = LoggerFactory.getLogger(Calculator.class);

    private final boolean strict;

    public Calculator() {
        this(true);
    }

    public Calculator(final boolean strict) {
        this.strict = strict;
    }

    public Evaluation evaluate(final String line, final VariableStore store) {
        assert line != null;
        try {
            final List<Token> infix = Tokenizer.tokenize(SignNormalizer.normalize(line));
            final List<Token> postfix = ShuntingYardConverter.toPostfix(infix);
            return new Evaluation.Value(new PostfixEvaluator(store, strict).evaluate(postfix));
        }
        catch (CalculatorException e) {
            LOG.debug("cannot evaluate '{}': {}", line, e.getMessage());
            return Evaluation.Failure.of(e);
        }
    }
}
