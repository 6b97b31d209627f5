package io.blockring.bench;

import io.blockring.core.BlockRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Synthetic write workload: a stream of files, each a run of blocks.
 * <p>
 * A linear file of n blocks is one fresh inode with indexes 1..n. A rewritten
 * file starts linear and then gets up to {@link #MAX_REWRITES} - 1 in-place
 * overwrites: each picks a random offset and length and replaces that span
 * with blocks of a freshly allocated inode, the way copy-on-write storage
 * lands small rewrites. A file is rewritten when a standard normal sample falls
 * below the configured rewrite fraction.
 * <p>
 * Deterministic for a given seed: all randomness comes from the injected source.
 */
public final class WorkloadGenerator {

    static final int MAX_FILE_BLOCKS = 1000;
    static final int MAX_REWRITES = 30;

    private final long volumeId;
    private final double rewriteFraction;
    private final Random rnd;
    private long nextInode = 1;

    public WorkloadGenerator(long volumeId, double rewriteFraction, Random rnd) {
        this.volumeId = volumeId;
        this.rewriteFraction = rewriteFraction;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    /** At least {@code blocks} block refs; the last file is never cut short. */
    public List<BlockRef> generate(long blocks) {
        List<BlockRef> out = new ArrayList<>((int) Math.min(blocks + MAX_FILE_BLOCKS, 1 << 20));
        while (out.size() < blocks) {
            int perFile = rnd.nextInt(MAX_FILE_BLOCKS) + 1;
            if (rnd.nextGaussian() < rewriteFraction) {
                out.addAll(rewrittenFile(perFile));
            } else {
                out.addAll(linearFile(perFile));
            }
        }
        return out;
    }

    List<BlockRef> linearFile(int size) {
        long inode = nextInode++;
        List<BlockRef> out = new ArrayList<>(size);
        for (int x = 1; x <= size; x++) {
            out.add(new BlockRef(volumeId, inode, x));
        }
        return out;
    }

    List<BlockRef> rewrittenFile(int size) {
        List<BlockRef> file = linearFile(size);
        int its = rnd.nextInt(MAX_REWRITES);
        for (int i = 0; i < its; i++) {
            int off = rnd.nextInt(file.size());
            int len = rnd.nextInt(file.size() - off);
            List<BlockRef> piece = linearFile(len);
            for (int j = 0; j < piece.size(); j++) {
                file.set(off + j, piece.get(j));
            }
        }
        return file;
    }

    /** Inodes handed out so far. */
    long inodesUsed() {
        return nextInode - 1;
    }
}
