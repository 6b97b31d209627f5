package io.blockring.core.rebalance;

import java.util.Objects;

/** Assignment valid against the new ring, plus what it costs to get there. */
public record RebalanceResult(ClusterState next, RebalanceStats stats) {

    public RebalanceResult {
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(stats, "stats");
    }
}
