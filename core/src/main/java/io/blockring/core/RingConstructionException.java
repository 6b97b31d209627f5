package io.blockring.core;

/**
 * A ring could not be built: bad replication factor, unusable peer set,
 * or an encoding that does not describe a valid ring.
 */
public final class RingConstructionException extends RingException {

    public RingConstructionException(String message) {
        super(message);
    }

    public RingConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
