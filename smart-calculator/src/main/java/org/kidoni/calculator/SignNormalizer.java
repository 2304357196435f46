package org.kidoni.calculator;

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses runs of {@code +} and {@code -} into a single sign and puts exactly one space between tokens.
 * <p>
 * The sign rewrites run once each, in this order, and are not repeated until nothing changes:
 * <pre>
 *  "--"      -> "+"
 *  "+"+      -> "+"
 *  "+-" | "-"+ -> "-"
 * </pre>
 * so {@code "1 --- 2"} becomes {@code "1 +- 2"} after the first pass and {@code "1 - 2"} after the last one,
 * while {@code "1 -+- 2"} comes out as {@code "1 -- 2"}.
 */
public final class SignNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(SignNormalizer.class);

    private static final Pattern DOUBLE_MINUS = Pattern.compile("--");
    private static final Pattern PLUS_RUN = Pattern.compile("\\++");
    private static final Pattern MINUS_RUN = Pattern.compile("\\+-|-+");
    private static final Pattern TOKEN = Pattern.compile("(-?\\d+|[-+*/()])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SignNormalizer() {
    }

    public static String normalize(final String line) {
        String signs = DOUBLE_MINUS.matcher(line).replaceAll("+");
        signs = PLUS_RUN.matcher(signs).replaceAll("+");
        signs = MINUS_RUN.matcher(signs).replaceAll("-");

        String spaced = TOKEN.matcher(signs).replaceAll(" $1 ");
        String normalized = WHITESPACE.matcher(spaced).replaceAll(" ").trim();

        LOG.debug("normalized '{}' to '{}'", line, normalized);
        return normalized;
    }
}
