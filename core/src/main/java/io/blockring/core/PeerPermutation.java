package io.blockring.core;

import java.util.Objects;

/**
 * Answer of a ring placement query for one block.
 * <p>
 * {@code peers} is rank ordered. The first {@code replication} entries are the
 * effective holders; any remaining entries are the order in which further
 * replicas would be placed if the replication factor grew.
 */
public record PeerPermutation(int replication, PeerList peers) {

    public PeerPermutation {
        Objects.requireNonNull(peers, "peers");
        if (replication < 0) throw new IllegalArgumentException("replication must be >= 0");
        if (peers.size() < replication) {
            throw new IllegalArgumentException(
                    "permutation has %d peers for replication %d".formatted(peers.size(), replication));
        }
    }

    /** The effective holders: the first {@code replication} peers. */
    public PeerList holders() {
        return peers.prefix(replication);
    }
}
