package org.linecalc.compiler.backend.eval;

import org.linecalc.api.ErrorKind;

import java.math.BigInteger;

/**
 * Outcome of evaluating an expression: either a value or a typed fault.
 * Faults are returned, never thrown.
 */
public sealed interface Evaluation permits Evaluation.Value, Evaluation.Fault {

    /**
     * A successful evaluation.
     * @param value The computed integer.
     */
    record Value(BigInteger value) implements Evaluation {}

    /**
     * A failed evaluation.
     * @param kind The kind of fault.
     * @param message The human-readable message, without any line prefix.
     */
    record Fault(ErrorKind kind, String message) implements Evaluation {}

    static Value of(BigInteger value) {
        return new Value(value);
    }

    static Fault fault(ErrorKind kind, Object... args) {
        return new Fault(kind, kind.format(args));
    }

    default boolean isFault() {
        return this instanceof Fault;
    }
}
