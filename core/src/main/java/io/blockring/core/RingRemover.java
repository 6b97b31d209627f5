package io.blockring.core;

/** Optional ring capability: shrink membership. */
public interface RingRemover extends ModifyableRing {

    /** A new ring whose members are the current members minus {@code goingAway}. */
    Ring removePeers(PeerList goingAway) throws RingException;
}
