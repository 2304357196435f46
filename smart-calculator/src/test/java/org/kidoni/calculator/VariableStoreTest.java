package org.kidoni.calculator;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableStoreTest {
    @Test
    void setAndGet() {
        final var store = new VariableStore();
        store.set("a", BigInteger.TEN);
        assertEquals(BigInteger.TEN, store.get("a"));

        store.set("a", BigInteger.TWO);
        assertEquals(BigInteger.TWO, store.get("a"));
        assertEquals(1, store.size());
    }

    @Test
    void getUnknown() {
        final var e = assertThrows(CalculatorException.class, () -> new VariableStore().get("a"));
        assertEquals(ErrorKind.UNKNOWN_VARIABLE, e.getKind());
    }

    @Test
    void setFromVariableCopiesValue() {
        final var store = new VariableStore();
        store.set("a", BigInteger.ONE);
        store.setFromVariable("b", "a");
        store.set("a", BigInteger.TEN);

        assertEquals(BigInteger.ONE, store.get("b"));
    }

    @Test
    void setFromUnknownVariableLeavesStoreUnchanged() {
        final var store = new VariableStore();
        store.set("b", BigInteger.ONE);

        final var e = assertThrows(CalculatorException.class, () -> store.setFromVariable("b", "a"));
        assertEquals(ErrorKind.UNKNOWN_VARIABLE, e.getKind());
        assertEquals(BigInteger.ONE, store.get("b"));
        assertFalse(store.contains("a"));
    }

    @Test
    void copyIsIndependent() {
        final var store = new VariableStore();
        store.set("a", BigInteger.ONE);

        final var copy = store.copy();
        copy.set("a", BigInteger.TEN);
        copy.set("b", BigInteger.TEN);

        assertEquals(BigInteger.ONE, store.get("a"));
        assertFalse(store.contains("b"));
        assertTrue(copy.contains("b"));
    }
}
