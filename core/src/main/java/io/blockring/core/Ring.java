package io.blockring.core;

/**
 * Versioned, immutable placement snapshot: membership, replication policy and a
 * deterministic function from block to rank-ordered peers.
 * <p>
 * Contract for implementations:
 *  - {@link #getPeers} is deterministic for a given version: the same block
 *    always yields an equal permutation, whatever else is happening.
 *  - The reported replication never exceeds the member count; when there are
 *    fewer members than the configured factor it is capped to the member count.
 *  - No method mutates the receiver, so readers need no locking. Topology
 *    changes go through the optional capabilities ({@link ModifyableRing},
 *    {@link RingAdder}, {@link RingRemover}) and return a new ring.
 * <p>
 * Capabilities are probed at runtime:
 * <pre>{@code
 * if (ring instanceof RingAdder adder) {
 *     next = adder.addPeers(joining);
 * } else {
 *     // caller policy: build a fresh ring instead
 * }
 * }</pre>
 */
public interface Ring {

    /**
     * Rank-ordered placement for one block.
     *
     * @throws PlacementException if the ring cannot place anything (e.g. it has no members)
     */
    PeerPermutation getPeers(BlockRef block) throws PlacementException;

    /** Current members, in an order that is stable for this version. */
    PeerList members();

    /** Human-readable summary for logs and tools. */
    String describe();

    RingType type();

    /** Increases by one with every topology change. */
    int version();

    /**
     * Encode this ring so that it can be rebuilt into an equivalent ring
     * (same type, version, replication, peers and therefore placements).
     */
    byte[] marshal() throws RingException;
}
