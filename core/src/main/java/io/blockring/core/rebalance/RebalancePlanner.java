package io.blockring.core.rebalance;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerList;
import io.blockring.core.PlacementException;
import io.blockring.core.Ring;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plans the move from an assignment made under one ring to an assignment under
 * another.
 * <p>
 * For every (holder, block) pair of the current state:
 * <ol>
 *   <li>Take the block's holders under both rings (each permutation cut to its
 *       own replication).</li>
 *   <li>If the holder is still a holder under the new ring it keeps the block.</li>
 *   <li>{@code diff} = new holders that were not old holders, in new-ring rank
 *       order. The holder's old rank {@code i} selects what it forwards:
 *       nothing if {@code i >= diff.size()}; every {@code diff[i..]} if it is
 *       the last old holder and {@code diff} is longer than the old holder
 *       list; otherwise just {@code diff[i]}.</li>
 * </ol>
 * Rank is the matching key between old and new holders, so movement follows the
 * topology delta instead of a full re-placement. The rule assumes placements are
 * stable under small edits. When the current state lacks some of the old
 * holders, new holders paired with the missing ranks receive nothing and the
 * block ends up under-replicated; the planner does not try to repair that.
 * <p>
 * Stateless; one instance can be shared.
 */
public final class RebalancePlanner {
    private static final Logger log = Logger.getLogger(RebalancePlanner.class.getName());

    /**
     * Compute the assignment under {@code newRing} and its cost.
     *
     * @param oldRing ring {@code current} was assigned against
     * @param newRing ring to move to
     * @param current assignment under {@code oldRing}; not modified
     * @throws PlacementException if either ring fails for any block; nothing is returned
     * @throws IllegalArgumentException if {@code current} has a holder that is not
     *                                  among the old ring's holders for that block
     */
    public RebalanceResult rebalance(Ring oldRing, Ring newRing, ClusterState current) throws PlacementException {
        Objects.requireNonNull(oldRing, "oldRing");
        Objects.requireNonNull(newRing, "newRing");
        Objects.requireNonNull(current, "current");

        ClusterState.Builder next = new ClusterState.Builder(newRing.members());
        long kept = 0;
        long sent = 0;

        for (Map.Entry<String, Set<BlockRef>> e : current.asMap().entrySet()) {
            String p = e.getKey();
            for (BlockRef ref : e.getValue()) {
                PeerList newpeers = newRing.getPeers(ref).holders();
                PeerList oldpeers = oldRing.getPeers(ref).holders();

                int myIndex = oldpeers.indexOf(p);
                if (myIndex < 0) {
                    throw new IllegalArgumentException(
                            "%s holds %s but is not among its holders %s in %s"
                                    .formatted(p, ref, oldpeers, oldRing.describe()));
                }

                if (newpeers.has(p)) {
                    next.add(p, ref);
                    kept++;
                }

                PeerList diff = newpeers.andNot(oldpeers);
                if (myIndex >= diff.size()) {
                    // shrinking at this rank: nothing to hand off
                    continue;
                }
                if (myIndex == oldpeers.size() - 1 && diff.size() > oldpeers.size()) {
                    for (int i = myIndex; i < diff.size(); i++) {
                        next.add(diff.get(i), ref);
                        sent++;
                    }
                } else {
                    next.add(diff.get(myIndex), ref);
                    sent++;
                }
            }
        }

        RebalanceStats stats = new RebalanceStats(kept, sent);
        log.log(Level.INFO, "rebalance {0} -> {1}: kept={2}, sent={3} ({4}%)", new Object[]{
                oldRing.describe(),
                newRing.describe(),
                Long.toString(kept),
                Long.toString(sent),
                String.format("%.2f", stats.percentSent())
        });
        return new RebalanceResult(next.build(), stats);
    }
}
