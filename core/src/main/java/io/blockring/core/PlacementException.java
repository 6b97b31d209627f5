package io.blockring.core;

/** A ring could not answer a placement query (for example, it has no members). */
public final class PlacementException extends RingException {

    public PlacementException(String message) {
        super(message);
    }
}
