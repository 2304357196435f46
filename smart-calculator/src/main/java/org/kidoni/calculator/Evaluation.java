package org.kidoni.calculator;

import java.math.BigInteger;

/**
 * Outcome of evaluating one line: either a value or the reason there is none.
 */
public sealed interface Evaluation {
    record Value(BigInteger value) implements Evaluation {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Failure(ErrorKind kind, String detail) implements Evaluation {
        static Failure of(final CalculatorException e) {
            return new Failure(e.getKind(), e.getMessage());
        }

        @Override
        public String toString() {
            return kind.message();
        }
    }
}
