package org.kidoni.calculator.repl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import org.kidoni.calculator.Calculator;
import org.kidoni.calculator.CalculatorException;
import org.kidoni.calculator.ErrorKind;
import org.kidoni.calculator.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads lines until {@code /exit} or end of input, printing one result or error message per line.
 */
public class CommandLoop {
    private static final Logger LOG = LoggerFactory.getLogger(CommandLoop.class);

    static final String HELP = """
            The program calculates integer expressions with + - * / and parentheses.
            Unary and binary minuses are supported, e.g. 2 -- 2 = 4
            Variables are assigned with name = value, e.g. a = 5 or b = a""";

    static final String BYE = "Bye!";

    private final BufferedReader reader;
    private final PrintStream out;
    private final VariableStore store;
    private final Calculator calculator;
    private final CalculatorSettings settings;

    public CommandLoop(final BufferedReader reader, final PrintStream out, final VariableStore store,
                       final CalculatorSettings settings) {
        this.reader = reader;
        this.out = out;
        this.store = store;
        this.settings = settings;
        this.calculator = new Calculator(settings.strict());
    }

    public void run() throws IOException {
        LOG.info("calculator session started (strict={})", settings.strict());

        String line;
        while ((line = readLine()) != null) {
            if (!execute(CommandParser.parse(line))) {
                break;
            }
        }

        LOG.info("calculator session ended with {} variable(s)", store.size());
    }

    private String readLine() throws IOException {
        if (!settings.prompt().isEmpty()) {
            out.print(settings.prompt());
            out.flush();
        }
        return reader.readLine();
    }

    /**
     * @return {@code false} when the loop should stop
     */
    boolean execute(final Command command) {
        try {
            if (command instanceof Command.Blank) {
                return true;
            }
            else if (command instanceof Command.Help) {
                out.println(HELP);
            }
            else if (command instanceof Command.Exit) {
                out.println(BYE);
                return false;
            }
            else if (command instanceof Command.Unknown unknown) {
                LOG.debug("unknown command {}", unknown.name());
                out.println(ErrorKind.UNKNOWN_COMMAND.message());
            }
            else if (command instanceof Command.Invalid invalid) {
                out.println(invalid.kind().message());
            }
            else if (command instanceof Command.AssignValue assign) {
                store.set(assign.name(), assign.value());
            }
            else if (command instanceof Command.AssignVariable assign) {
                store.setFromVariable(assign.name(), assign.sourceName());
            }
            else if (command instanceof Command.PrintVariable print) {
                out.println(store.get(print.name()));
            }
            else if (command instanceof Command.EvaluateExpression expression) {
                out.println(calculator.evaluate(expression.expression(), store));
            }
        }
        catch (CalculatorException e) {
            LOG.debug("{}: {}", e.getKind(), e.getMessage());
            out.println(e.getKind().message());
        }
        return true;
    }
}
