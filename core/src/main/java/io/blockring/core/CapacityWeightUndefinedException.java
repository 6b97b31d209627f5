package io.blockring.core;

/** Every peer reported zero capacity, so no capacity ratio exists. */
public final class CapacityWeightUndefinedException extends RingException {

    public CapacityWeightUndefinedException(int peers) {
        super("capacity weights undefined: all " + peers + " peers report zero capacity");
    }
}
