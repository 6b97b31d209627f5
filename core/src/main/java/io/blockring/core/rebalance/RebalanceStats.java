package io.blockring.core.rebalance;

/**
 * Cost of a rebalance, counted in replica slots.
 *
 * @param blocksKept replicas that stay on the peer already holding them
 * @param blocksSent replicas that must be transmitted to a new holder
 */
public record RebalanceStats(long blocksKept, long blocksSent) {

    public long total() {
        return blocksKept + blocksSent;
    }

    /** Share of replica slots that move, in percent; 0 when nothing was planned. */
    public double percentSent() {
        long total = total();
        return total == 0 ? 0.0 : blocksSent * 100.0 / total;
    }
}
