package io.blockring.bench;

import io.blockring.core.RingType;
import io.blockring.core.UnknownRingTypeException;

import java.nio.file.Path;

/**
 * ringtool configuration parsed from CLI args.
 *
 * Supports:
 *  - ringType:       ring kind to simulate (mod, ketama, single, empty)
 *  - replication:    replication factor of the starting ring
 *  - replicationEnd: replication factor of the target ring (0 = same as start)
 *  - nodes:          peers in the starting ring
 *  - delta:          peers to add (positive) or remove (zero or negative)
 *  - blockSize:      bytes per block
 *  - totalData:      bytes of simulated data
 *  - rewritePercent: share of files that get small in-place rewrites
 *  - seed:           seed of the workload and peer-id random source
 *  - peersFile:      optional JSON peer list with capacities
 */
public record RingToolConfig(
        RingType ringType,
        int replication,
        int replicationEnd,
        int nodes,
        int delta,
        long blockSize,
        long totalData,
        int rewritePercent,
        long seed,
        Path peersFile,
        boolean help
) {

    public RingToolConfig {
        if (replication < 0) throw new CliException("rep must be >= 0");
        if (replicationEnd < 0) throw new CliException("rep-end must be >= 0");
        if (nodes < 0) throw new CliException("nodes must be >= 0");
        if (nodes + delta < 0) throw new CliException("cannot remove " + (-delta) + " of " + nodes + " nodes");
        if (blockSize <= 0) throw new CliException("block-size must be > 0");
        if (totalData < 0) throw new CliException("total-data must be >= 0");
        if (rewritePercent < 0 || rewritePercent > 100) throw new CliException("rewrite-edge must be in [0,100]");
    }

    /** Replication of the target ring. */
    public int targetReplication() {
        return replicationEnd == 0 ? replication : replicationEnd;
    }

    /** Peers needed across both rings. */
    public int totalPeers() {
        return delta > 0 ? nodes + delta : nodes;
    }

    /** Blocks to simulate; the workload may overshoot by up to one file. */
    public long blockCount() {
        return totalData / blockSize;
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --ring          <mod|ketama|single|empty>
     *   --rep           <n>
     *   --rep-end       <n>
     *   --nodes         <n>
     *   --delta         <n>
     *   --block-size    <size>
     *   --total-data    <size>
     *   --rewrite-edge  <percent>
     *   --seed          <n>
     *   --peers         <path>
     *   --help,  -h
     *
     * @throws CliException on unknown flags or malformed values
     */
    public static RingToolConfig fromArgs(String[] args) {
        // Defaults
        String ring = "mod";
        int rep = 2;
        int repEnd = 0;
        int nodes = 4;
        int delta = 2;
        String blockSize = "256KiB";
        String totalData = "16GiB";
        int rewrite = 40;
        long seed = 1L;
        Path peers = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;
                case "--ring" -> ring = value(args, i++);
                case "--rep" -> rep = intValue(args, i++);
                case "--rep-end" -> repEnd = intValue(args, i++);
                case "--nodes" -> nodes = intValue(args, i++);
                case "--delta" -> delta = intValue(args, i++);
                case "--block-size" -> blockSize = value(args, i++);
                case "--total-data" -> totalData = value(args, i++);
                case "--rewrite-edge" -> rewrite = intValue(args, i++);
                case "--seed" -> {
                    String v = value(args, i++);
                    try {
                        seed = Long.parseLong(v);
                    } catch (NumberFormatException e) {
                        throw new CliException("invalid --seed: " + v);
                    }
                }
                case "--peers" -> peers = Path.of(value(args, i++));
                default -> throw new CliException("unknown option: " + args[i]);
            }
        }

        RingType type;
        try {
            type = RingType.parse(ring);
        } catch (UnknownRingTypeException e) {
            throw new CliException(e.getMessage(), e);
        }

        return new RingToolConfig(
                type,
                rep,
                repEnd,
                nodes,
                delta,
                size("block-size", blockSize),
                size("total-data", totalData),
                rewrite,
                seed,
                peers,
                help
        );
    }

    static String usage() {
        return """
            Usage: ringtool [options]

            Simulates a topology change and reports how many blocks the rebalance moves.

            Options:
              --ring           Ring type: mod, ketama, single, empty (default: mod)
              --rep            Starting replication (default: 2)
              --rep-end        Target replication, 0 = same as start (default: 0)
              --nodes          Peers in the starting ring (default: 4)
              --delta          Peers to add (positive) or remove (<= 0) (default: 2)
              --block-size     Block size (default: 256KiB)
              --total-data     Total data simulated (default: 16GiB)
              --rewrite-edge   Percentage of files with small rewrites (default: 40)
              --seed           Random seed (default: 1)
              --peers          JSON file listing peers and capacities (optional)
              --help,  -h      Show this help message
            """;
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int intValue(String[] args, int i) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new CliException("invalid " + args[i] + ": " + v);
        }
    }

    private static long size(String name, String v) {
        try {
            return ByteSize.parse(v);
        } catch (IllegalArgumentException e) {
            throw new CliException("error parsing " + name + ": " + e.getMessage(), e);
        }
    }
}
