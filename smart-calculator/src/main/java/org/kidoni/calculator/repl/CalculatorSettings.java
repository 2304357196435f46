package org.kidoni.calculator.repl;

import java.util.Map;

/**
 * Settings read from the environment.
 *
 * @param strict reject expressions that leave more than one operand, {@code CALCULATOR_STRICT}
 * @param prompt printed before every line read, {@code CALCULATOR_PROMPT}
 */
public record CalculatorSettings(boolean strict, String prompt) {
    static final String STRICT_ENV = "CALCULATOR_STRICT";
    static final String PROMPT_ENV = "CALCULATOR_PROMPT";

    public static CalculatorSettings defaults() {
        return new CalculatorSettings(true, "");
    }

    public static CalculatorSettings fromEnvironment() {
        return from(System.getenv());
    }

    static CalculatorSettings from(final Map<String, String> env) {
        final String strict = env.get(STRICT_ENV);
        final String prompt = env.get(PROMPT_ENV);
        return new CalculatorSettings(
                strict == null || !strict.trim().equalsIgnoreCase("false"),
                prompt != null ? prompt : "");
    }
}
