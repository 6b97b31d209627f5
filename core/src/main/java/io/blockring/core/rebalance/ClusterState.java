package io.blockring.core.rebalance;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerList;
import io.blockring.core.PeerPermutation;
import io.blockring.core.PlacementException;
import io.blockring.core.Ring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Materialized block assignment: for every peer, the set of blocks it holds.
 * <p>
 * Immutable once built. A new state is computed for every ring adopted; states
 * never share their block sets, so an old state stays intact while a new one is
 * built from it.
 */
public final class ClusterState {

    /** Per-peer block counts summarized across the cluster. */
    public record Balance(long total, double mean, double stddev) {}

    private final Map<String, Set<BlockRef>> holdings;

    /** Deep copy of {@code holdings}; peer iteration order is preserved. */
    public ClusterState(Map<String, ? extends Set<BlockRef>> holdings) {
        Objects.requireNonNull(holdings, "holdings");
        Map<String, Set<BlockRef>> copy = new LinkedHashMap<>();
        for (var e : holdings.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        this.holdings = Collections.unmodifiableMap(copy);
    }

    /**
     * Place every block on the ring: each of the first {@code replication}
     * peers of its permutation holds it. Every ring member appears in the
     * result, possibly with no blocks.
     *
     * @throws PlacementException if the ring fails for any block; no partial state is returned
     */
    public static ClusterState assign(Ring ring, Iterable<BlockRef> blocks) throws PlacementException {
        Builder b = new Builder(ring.members());
        for (BlockRef block : blocks) {
            PeerPermutation perm = ring.getPeers(block);
            for (String p : perm.holders()) {
                b.add(p, block);
            }
        }
        return b.build();
    }

    /** Peers in this state, in the order the producing ring listed them. */
    public Set<String> peers() {
        return holdings.keySet();
    }

    /** Blocks held by {@code peer}; empty if the peer is unknown. */
    public Set<BlockRef> blocksFor(String peer) {
        return holdings.getOrDefault(peer, Set.of());
    }

    public Map<String, Set<BlockRef>> asMap() {
        return holdings;
    }

    /** Number of (block, holder) pairs. */
    public long totalReplicas() {
        long total = 0;
        for (Set<BlockRef> blocks : holdings.values()) {
            total += blocks.size();
        }
        return total;
    }

    /** How many peers hold {@code block}. */
    public int replicaCount(BlockRef block) {
        int n = 0;
        for (Set<BlockRef> blocks : holdings.values()) {
            if (blocks.contains(block)) n++;
        }
        return n;
    }


    /** Block count per peer, in peer order. */
    public Map<String, Integer> blockCounts() {
        Map<String, Integer> out = new LinkedHashMap<>();
        holdings.forEach((p, blocks) -> out.put(p, blocks.size()));
        return out;
    }

    /** Total, mean and population standard deviation of per-peer block counts. */
    public Balance balance() {
        if (holdings.isEmpty()) {
            return new Balance(0, 0.0, 0.0);
        }
        long total = totalReplicas();
        double mean = total / (double) holdings.size();
        double v = 0.0;
        for (Set<BlockRef> blocks : holdings.values()) {
            double d = blocks.size() - mean;
            v += d * d;
        }
        return new Balance(total, mean, Math.sqrt(v / holdings.size()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClusterState other)) return false;
        return holdings.equals(other.holdings);
    }

    @Override
    public int hashCode() {
        return holdings.hashCode();
    }

    @Override
    public String toString() {
        return "ClusterState" + blockCounts();
    }

    /** Mutable accumulator for a state under construction. Not thread safe. */
    static final class Builder {
        private final Map<String, Set<BlockRef>> holdings = new LinkedHashMap<>();

        Builder(PeerList members) {
            for (String p : members) {
                holdings.put(p, new LinkedHashSet<>());
            }
        }

        void add(String peer, BlockRef block) {
            holdings.computeIfAbsent(peer, k -> new LinkedHashSet<>()).add(block);
        }

        ClusterState build() {
            return new ClusterState(holdings);
        }
    }
}
