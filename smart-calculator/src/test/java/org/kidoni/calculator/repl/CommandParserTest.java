package org.kidoni.calculator.repl;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;
import org.kidoni.calculator.ErrorKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class CommandParserTest {
    @Test
    void parseBlank() {
        assertInstanceOf(Command.Blank.class, CommandParser.parse(""));
        assertInstanceOf(Command.Blank.class, CommandParser.parse("   "));
    }

    @Test
    void parseSlashCommands() {
        assertInstanceOf(Command.Help.class, CommandParser.parse("/help"));
        assertInstanceOf(Command.Exit.class, CommandParser.parse("/exit"));
        assertEquals(new Command.Unknown("/go"), CommandParser.parse("/go"));
    }

    @Test
    void parseAssignments() {
        assertEquals(new Command.AssignValue("a", BigInteger.valueOf(5)), CommandParser.parse("a = 5"));
        assertEquals(new Command.AssignValue("abc", BigInteger.valueOf(-12)), CommandParser.parse("abc=-12"));
        assertEquals(new Command.AssignVariable("b", "a"), CommandParser.parse(" b =  a "));
    }

    @Test
    void parseInvalidAssignments() {
        assertEquals(new Command.Invalid(ErrorKind.INVALID_ASSIGNMENT), CommandParser.parse("a = 1 = 2"));
        assertEquals(new Command.Invalid(ErrorKind.INVALID_ASSIGNMENT), CommandParser.parse("a = 2b"));
        assertEquals(new Command.Invalid(ErrorKind.INVALID_ASSIGNMENT), CommandParser.parse("a ="));
        assertEquals(new Command.Invalid(ErrorKind.INVALID_IDENTIFIER), CommandParser.parse("a1 = 3"));
        assertEquals(new Command.Invalid(ErrorKind.INVALID_IDENTIFIER), CommandParser.parse("= 3"));
    }

    @Test
    void parseVariableAndExpression() {
        assertEquals(new Command.PrintVariable("abc"), CommandParser.parse(" abc "));
        assertEquals(new Command.EvaluateExpression("a + 1"), CommandParser.parse("a + 1"));
        assertEquals(new Command.EvaluateExpression("12"), CommandParser.parse("12"));
    }
}
