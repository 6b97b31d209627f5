package io.blockring.core;

/**
 * Base of all failures raised by rings, ring construction and rebalance planning.
 */
public class RingException extends Exception {

    public RingException(String message) {
        super(message);
    }

    public RingException(String message, Throwable cause) {
        super(message, cause);
    }
}
