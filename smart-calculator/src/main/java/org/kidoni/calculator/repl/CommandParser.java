package org.kidoni.calculator.repl;

import java.math.BigInteger;

import org.kidoni.calculator.ErrorKind;
import org.kidoni.calculator.Token;

/**
 * Classifies an input line.
 * <p>
 * Grammar:
 * <pre>
 *  Line: Blank | '/' Name | Assignment | Identifier | Expression
 *  Assignment: Identifier WS '=' WS ( Identifier | Integer )
 *  Identifier: '[A-Za-z]'+
 *  Integer: '[+-]'? '[0-9]'+
 * </pre>
 * Whitespace is ignored inside an assignment.
 */
public final class CommandParser {
    private CommandParser() {
    }

    public static Command parse(final String line) {
        final String trimmed = line.trim();

        if (trimmed.isEmpty()) {
            return new Command.Blank();
        }
        if (trimmed.startsWith("/")) {
            return parseSlashCommand(trimmed);
        }
        if (trimmed.indexOf('=') >= 0) {
            return parseAssignment(trimmed);
        }
        if (Token.isIdentifier(trimmed)) {
            return new Command.PrintVariable(trimmed);
        }
        return new Command.EvaluateExpression(trimmed);
    }

    private static Command parseSlashCommand(final String trimmed) {
        return switch (trimmed) {
            case "/help" -> new Command.Help();
            case "/exit" -> new Command.Exit();
            default -> new Command.Unknown(trimmed);
        };
    }

    private static Command parseAssignment(final String trimmed) {
        final String[] parts = trimmed.replace(" ", "").split("=", -1);
        if (parts.length != 2) {
            return new Command.Invalid(ErrorKind.INVALID_ASSIGNMENT);
        }

        final String name = parts[0];
        final String value = parts[1];
        if (!Token.isIdentifier(name)) {
            return new Command.Invalid(ErrorKind.INVALID_IDENTIFIER);
        }
        if (Token.isIdentifier(value)) {
            return new Command.AssignVariable(name, value);
        }

        try {
            return new Command.AssignValue(name, new BigInteger(value));
        }
        catch (NumberFormatException e) {
            return new Command.Invalid(ErrorKind.INVALID_ASSIGNMENT);
        }
    }
}
