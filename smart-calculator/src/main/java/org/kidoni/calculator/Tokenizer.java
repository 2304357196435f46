package org.kidoni.calculator;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a normalized line into tokens.
 * <p>
 * Grammar of a whitespace separated piece:
 * <pre>
 *  Number: '-'? '[0-9]'+
 *  Identifier: '[A-Za-z]'+
 *  Signs: ( '+' | '-' | '*' | '/' | '(' | ')' )+
 * </pre>
 */
public final class Tokenizer {
    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    private Tokenizer() {
    }

    public static List<Token> tokenize(final String normalized) {
        final List<Token> tokens = new ArrayList<>();

        final String trimmed = normalized.trim();
        if (trimmed.isEmpty()) {
            return tokens;
        }

        for (String piece : trimmed.split("\\s+")) {
            if (Token.isNumber(piece)) {
                addNumber(tokens, piece);
            }
            else if (Token.isIdentifier(piece)) {
                tokens.add(new Token.IdentifierToken(piece));
            }
            else {
                // signs left fused together, e.g. "-(" or "*-"
                for (char c : piece.toCharArray()) {
                    tokens.add(Operator.tokenOf(c));
                }
            }
        }

        LOG.debug("tokens: {}", tokens);
        return tokens;
    }

    // "4-2" is spaced as "4 -2": a negative literal right after an operand is a binary minus
    private static void addNumber(final List<Token> tokens, final String literal) {
        if (literal.charAt(0) == '-' && !tokens.isEmpty() && endsOperand(tokens.get(tokens.size() - 1))) {
            tokens.add(new Token.OperatorToken(Operator.MINUS));
            tokens.add(new Token.NumberToken(literal.substring(1)));
        }
        else {
            tokens.add(new Token.NumberToken(literal));
        }
    }

    private static boolean endsOperand(final Token token) {
        return token instanceof Token.NumberToken
                || token instanceof Token.IdentifierToken
                || token instanceof Token.RightParen;
    }
}
