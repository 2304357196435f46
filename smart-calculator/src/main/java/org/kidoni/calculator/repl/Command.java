package org.kidoni.calculator.repl;

import java.math.BigInteger;

import org.kidoni.calculator.ErrorKind;

/**
 * A parsed input line.
 */
public sealed interface Command {
    record Blank() implements Command {
    }

    record Help() implements Command {
    }

    record Exit() implements Command {
    }

    record Unknown(String name) implements Command {
    }

    record AssignValue(String name, BigInteger value) implements Command {
    }

    record AssignVariable(String name, String sourceName) implements Command {
    }

    record PrintVariable(String name) implements Command {
    }

    record EvaluateExpression(String expression) implements Command {
    }

    /**
     * A line that is recognizably a command of some kind but malformed, e.g. {@code a = 1 = 2}.
     */
    record Invalid(ErrorKind kind) implements Command {
    }
}
