package org.kidoni.calculator.repl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.kidoni.calculator.VariableStore;

public class SmartCalculator {
    public static void main(String[] args) throws IOException {
        final CalculatorSettings settings = CalculatorSettings.fromEnvironment();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            new CommandLoop(reader, System.out, new VariableStore(), settings).run();
        }
    }
}
