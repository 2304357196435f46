package org.kidoni.calculator;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Named integer variables of a calculator session. Variables can be rebound but never removed.
 * Not thread safe.
 */
public class VariableStore {
    private final Map<String, BigInteger> variables;

    public VariableStore() {
        this(new HashMap<>());
    }

    private VariableStore(final Map<String, BigInteger> variables) {
        this.variables = variables;
    }

    /**
     * @throws CalculatorException of kind {@link ErrorKind#UNKNOWN_VARIABLE} if {@code name} is not bound
     */
    public BigInteger get(final String name) {
        final BigInteger value = variables.get(name);
        if (value == null) {
            throw CalculatorException.unknownVariable(name);
        }
        return value;
    }

    public void set(final String name, final BigInteger value) {
        assert name != null && value != null;
        variables.put(name, value);
    }

    /**
     * Binds {@code name} to the current value of {@code sourceName}. The store is unchanged if the source is unknown.
     */
    public void setFromVariable(final String name, final String sourceName) {
        set(name, get(sourceName));
    }

    public boolean contains(final String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    public VariableStore copy() {
        return new VariableStore(new HashMap<>(variables));
    }

    @Override
    public String toString() {
        return variables.toString();
    }
}
