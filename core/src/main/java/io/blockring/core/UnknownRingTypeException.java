package io.blockring.core;

/** Raised when a ring kind name or type does not map to any known ring implementation. */
public final class UnknownRingTypeException extends RingException {

    public UnknownRingTypeException(String name) {
        super("unknown ring type: " + name);
    }
}
