package io.blockring.core;

/** Optional ring capability: grow membership. */
public interface RingAdder extends ModifyableRing {

    /**
     * A new ring whose members are the current members followed by the
     * {@code newPeers} not already present. Blocks whose placement does not
     * involve the new peers should keep their placement.
     */
    Ring addPeers(PeerInfoList newPeers) throws RingException;
}
