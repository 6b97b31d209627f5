package io.blockring.bench;

import io.blockring.core.BlockRef;
import io.blockring.core.ModifyableRing;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.Ring;
import io.blockring.core.RingAdder;
import io.blockring.core.RingException;
import io.blockring.core.RingRemover;
import io.blockring.core.rebalance.ClusterState;
import io.blockring.core.rebalance.RebalancePlanner;
import io.blockring.core.rebalance.RebalanceResult;
import io.blockring.core.rebalance.RebalanceStats;
import io.blockring.core.ring.RingDescriptor;
import io.blockring.core.ring.Rings;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Rebalance simulator.
 *
 * Builds a starting ring and a target ring from the CLI configuration, writes a
 * synthetic workload against the starting ring, plans the rebalance, and prints
 * the per-peer balance before and after plus the movement cost.
 *
 * Usage:
 *   java -jar ringtool.jar --ring ketama --nodes 6 --delta 2 --rep 3
 *
 * Exit status: 0 on success, 1 on bad configuration or a ring failure.
 */
public final class RingTool {
    private static final Logger log = Logger.getLogger(RingTool.class.getName());

    /** Capacity given to generated peers: 100 Gi blocks each. */
    static final long DEFAULT_PEER_BLOCKS = 100L * 1024 * 1024 * 1024;

    /** Ring the workload is assigned against, and the ring it moves to. */
    record RingPair(Ring from, Ring to) {}

    private RingTool() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        try {
            RingToolConfig cfg = RingToolConfig.fromArgs(args);
            if (cfg.help()) {
                System.out.println(RingToolConfig.usage());
                return;
            }
            run(cfg, System.out);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(RingToolConfig.usage());
            System.exit(1);
        } catch (RingException e) {
            log.log(Level.WARNING, "ring failure", e);
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Run one simulation, writing the report to {@code out}. */
    static RebalanceResult run(RingToolConfig cfg, PrintStream out) throws RingException {
        Random rnd = new Random(cfg.seed());
        PeerInfoList peers = buildPeers(cfg, rnd);

        var workload = new WorkloadGenerator(1L, cfg.rewritePercent() / 100.0, rnd);
        List<BlockRef> blocks = workload.generate(cfg.blockCount());
        log.log(Level.INFO, "generated {0} blocks over {1} inodes",
                new Object[]{Integer.toString(blocks.size()), Long.toString(workload.inodesUsed())});

        RingPair rings = createRings(cfg, peers);
        Ring from = rings.from();
        Ring to = rings.to();
        log.log(Level.INFO, "from {0}", from.describe());
        log.log(Level.INFO, "to {0}", to.describe());

        out.printf("Unique blocks: %d%n", blocks.size());
        ClusterState cluster = ClusterState.assign(from, blocks);
        out.println("@START *****");
        printBalance(cluster, cfg.blockSize(), out);

        RebalanceResult result = new RebalancePlanner().rebalance(from, to, cluster);
        out.println("@END *****");
        printBalance(result.next(), cfg.blockSize(), out);
        out.println("Changes:");
        printStats(result.stats(), cfg, out);
        return result;
    }

    /**
     * Peers for both rings: from the peer file if given, otherwise generated
     * with ids drawn from {@code rnd} and {@link #DEFAULT_PEER_BLOCKS} capacity.
     */
    static PeerInfoList buildPeers(RingToolConfig cfg, Random rnd) {
        int needed = cfg.totalPeers();
        if (cfg.peersFile() != null) {
            PeerInfoList fromFile = PeerFile.load(cfg.peersFile());
            if (fromFile.size() < needed) {
                throw new CliException("%s lists %d peers, simulation needs %d"
                        .formatted(cfg.peersFile(), fromFile.size(), needed));
            }
            return PeerInfoList.copyOf(fromFile.asList().subList(0, needed));
        }
        List<PeerInfo> out = new ArrayList<>(needed);
        for (int i = 0; i < needed; i++) {
            String id = new UUID(rnd.nextLong(), rnd.nextLong()).toString();
            out.add(new PeerInfo(id, DEFAULT_PEER_BLOCKS));
        }
        return PeerInfoList.copyOf(out);
    }

    /**
     * Starting ring over the first {@code nodes} peers, and the target ring.
     * <p>
     * The target is derived through the ring's own capabilities when it has
     * them ({@link RingAdder} to grow, {@link RingRemover} to shrink, then
     * {@link ModifyableRing} for a replication change). A ring without the
     * needed capability gets a fresh target ring of the same type at version 2.
     */
    static RingPair createRings(RingToolConfig cfg, PeerInfoList peers) throws RingException {
        List<PeerInfo> all = peers.asList();
        int nodes = cfg.nodes();
        int delta = cfg.delta();

        Ring from = Rings.create(RingDescriptor.of(
                cfg.ringType(), 1, cfg.replication(), PeerInfoList.copyOf(all.subList(0, nodes))));

        Ring to = null;
        if (delta > 0 && from instanceof RingAdder adder) {
            to = adder.addPeers(PeerInfoList.copyOf(all.subList(nodes, nodes + delta)));
        } else if (delta <= 0 && from instanceof RingRemover remover) {
            to = remover.removePeers(PeerInfoList.copyOf(all.subList(nodes + delta, nodes)).peerList());
        }

        if (to != null && cfg.targetReplication() != cfg.replication()) {
            if (to instanceof ModifyableRing modifyable) {
                to = modifyable.changeReplication(cfg.targetReplication());
            } else {
                to = null;
            }
        }

        if (to == null) {
            log.log(Level.INFO, "{0} ring cannot be changed in place; building a fresh target ring",
                    cfg.ringType().label());
            to = Rings.create(RingDescriptor.of(
                    cfg.ringType(), 2, cfg.targetReplication(),
                    PeerInfoList.copyOf(all.subList(0, nodes + delta))));
        }
        return new RingPair(from, to);
    }

    static void printBalance(ClusterState cluster, long blockSize, PrintStream out) {
        out.println("Balance:");
        for (Map.Entry<String, Integer> e : cluster.blockCounts().entrySet()) {
            out.printf("\t%s: %d%n", e.getKey(), e.getValue());
        }
        ClusterState.Balance b = cluster.balance();
        out.printf("Total: %s, Mean: %s, Stddev: %s%n",
                ByteSize.formatIec(b.total() * blockSize),
                ByteSize.formatIec((long) b.mean() * blockSize),
                ByteSize.formatIec((long) b.stddev() * blockSize));
    }

    static void printStats(RebalanceStats s, RingToolConfig cfg, PrintStream out) {
        long blockSize = cfg.blockSize();
        out.printf("Blocks Kept: %d%n", s.blocksKept());
        out.printf("Blocks Sent: %d%n", s.blocksSent());
        out.printf(Locale.ROOT, "Percentage Sent: %.2f%n", s.percentSent());
        out.printf("Network Traffic: %s%n", ByteSize.formatIec(s.blocksSent() * blockSize));
        out.printf("Perfect Traffic: %s%n", ByteSize.formatIec(perfectTraffic(s, cfg)));
    }

    /**
     * Bytes a perfectly balanced placement would move: the share of the data
     * that belongs on the joining (or leaving) peers.
     */
    static long perfectTraffic(RebalanceStats s, RingToolConfig cfg) {
        int after = cfg.nodes() + cfg.delta();
        if (after == 0) return 0;
        double total = (double) s.total() * cfg.blockSize();
        return (long) (total * Math.abs((double) cfg.delta() / after));
    }

    private static void configureLogging() {
        try (InputStream in = RingTool.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not read logging.properties: " + e.getMessage());
        }
    }
}
