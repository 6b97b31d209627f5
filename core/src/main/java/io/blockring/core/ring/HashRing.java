package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PeerList;
import io.blockring.core.PeerPermutation;
import io.blockring.core.PlacementException;
import io.blockring.core.Ring;
import io.blockring.core.RingAdder;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingException;
import io.blockring.core.RingRemover;
import io.blockring.core.RingType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consistent hashing ring with capacity-weighted virtual nodes (ketama style).
 *
 * Responsibilities:
 *  - Give every peer a number of 64-bit tokens proportional to its capacity
 *    weight ({@link PeerInfoList#weights()}), so bigger disks own more blocks.
 *  - For any block, return every distinct peer in the order met by walking
 *    clockwise from the block's token.
 *
 * Properties:
 *  - Deterministic: same peers, weights and vnode base produce the same ring.
 *  - Minimal movement on membership change: a joining peer only takes the
 *    arcs in front of its own tokens, about weight/totalWeight of the blocks.
 *  - Peers with weight 0 are members but own no tokens, so they never appear
 *    in a permutation.
 */
public final class HashRing extends AbstractRing implements RingAdder, RingRemover {
    private static final Logger log = Logger.getLogger(HashRing.class.getName());

    /** Virtual nodes given to the lightest peer. */
    public static final int DEFAULT_VNODES = 128;

    /** Upper bound on tokens in one ring, across all peers. */
    static final long MAX_TOKENS = 1L << 22;

    // Sorted array of tokens on the ring (unsigned ordering).
    private final long[] tokens;

    // Parallel array: tokens[i] is owned by owners[i].
    private final String[] owners;

    // Peers that own at least one token.
    private final int placeable;

    private final PeerList members;
    private final int baseVnodes;

    private HashRing(int version, int replicationFactor, PeerInfoList peers, int baseVnodes,
                     long[] tokens, String[] owners, int placeable) throws RingConstructionException {
        super(version, replicationFactor, peers);
        this.tokens = tokens;
        this.owners = owners;
        this.placeable = placeable;
        this.members = peers.peerList();
        this.baseVnodes = baseVnodes;
    }

    public static HashRing build(int version, int replicationFactor, PeerInfoList peers) throws RingException {
        return build(version, replicationFactor, peers, DEFAULT_VNODES);
    }

    /**
     * Build a ring over the given peers.
     *
     * @param baseVnodes virtual nodes for the lowest positive weight; heavier
     *                   peers get proportionally more
     * @throws io.blockring.core.CapacityWeightUndefinedException if every peer has zero capacity
     * @throws RingConstructionException on a bad replication factor, duplicate peers,
     *                                   or a weight spread that needs too many tokens
     */
    public static HashRing build(int version, int replicationFactor, PeerInfoList peers, int baseVnodes)
            throws RingException {
        if (baseVnodes <= 0) throw new RingConstructionException("vnodes must be > 0");
        validate(replicationFactor, peers);

        Map<String, Long> weights = peers.weights();
        long minWeight = Long.MAX_VALUE;
        for (long w : weights.values()) {
            if (w > 0) minWeight = Math.min(minWeight, w);
        }

        Map<String, Integer> vnodes = new LinkedHashMap<>();
        long total = 0;
        for (var e : weights.entrySet()) {
            long w = e.getValue();
            long count = w == 0 ? 0 : Math.max(1, Math.round((double) baseVnodes * w / minWeight));
            if (count > MAX_TOKENS - total) {
                throw new RingConstructionException(
                        "capacity spread needs more than %d tokens; peer %s alone needs %d"
                                .formatted(MAX_TOKENS, e.getKey(), count));
            }
            total += count;
            vnodes.put(e.getKey(), (int) count);
        }

        MessageDigest md = sha256();
        int n = (int) total;
        long[] toks = new long[n];
        String[] own = new String[n];
        int idx = 0;
        int placeable = 0;
        for (PeerInfo p : peers) {
            int count = vnodes.get(p.peerId());
            if (count > 0) placeable++;
            for (int i = 0; i < count; i++) {
                toks[idx] = hash64(md, (p.peerId() + "#" + i).getBytes(StandardCharsets.UTF_8));
                own[idx] = p.peerId();
                idx++;
            }
            log.log(Level.FINE, "{0}: {1} vnodes", new Object[]{p.peerId(), count});
        }

        // sort by unsigned token
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Long.compareUnsigned(toks[a], toks[b]));

        long[] st = new long[n];
        String[] so = new String[n];
        for (int i = 0; i < n; i++) {
            st[i] = toks[order[i]];
            so[i] = own[order[i]];
        }

        return new HashRing(version, replicationFactor, peers, baseVnodes, st, so, placeable);
    }

    /**
     * Every placeable peer for this block, walking clockwise from the block's
     * token. Replication is capped to the number of placeable peers.
     */
    @Override
    public PeerPermutation getPeers(BlockRef block) throws PlacementException {
        if (tokens.length == 0) {
            throw new PlacementException("ketama ring v" + version + " has no placeable peers for " + block);
        }
        long t = hash64(sha256Unchecked(), block.toBytes());
        int start = lowerBoundUnsigned(tokens, t);

        List<String> res = new ArrayList<>(placeable);
        Set<String> seen = new HashSet<>(placeable * 2);

        // Walk around the ring at most tokens.length steps, wrapping around.
        for (int i = 0; i < tokens.length && res.size() < placeable; i++) {
            String owner = owners[(start + i) % tokens.length];
            if (seen.add(owner)) {
                res.add(owner);
            }
        }
        return new PeerPermutation(effectiveReplication(res.size()), PeerList.copyOf(res));
    }

    @Override
    public PeerList members() {
        return members;
    }

    @Override
    public RingType type() {
        return RingType.KETAMA;
    }

    @Override
    RingDescriptor descriptor() {
        return new RingDescriptor(type(), version, replicationFactor, baseVnodes, peers.asList());
    }

    @Override
    public String describe() {
        return super.describe() + ", " + tokens.length + " vnodes";
    }

    @Override
    public Ring changeReplication(int replication) throws RingException {
        return build(version + 1, replication, peers, baseVnodes);
    }

    @Override
    public Ring addPeers(PeerInfoList newPeers) throws RingException {
        return build(version + 1, replicationFactor, peers.union(newPeers), baseVnodes);
    }

    @Override
    public Ring removePeers(PeerList goingAway) throws RingException {
        return build(version + 1, replicationFactor, peers.andNot(goingAway), baseVnodes);
    }

    // ---------- helpers ----------

    private static long hash64(MessageDigest md, byte[] data) {
        md.reset();
        md.update(data);
        byte[] h = md.digest();
        // take the first 8 bytes as unsigned 64-bit (big-endian for deterministic ordering)
        return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
    }

    private static MessageDigest sha256() throws RingConstructionException {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RingConstructionException("SHA-256 unavailable", e);
        }
    }

    private static MessageDigest sha256Unchecked() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException(e);
        }
    }

    /**
     * Return the first index i such that tokens[i] >= t under unsigned comparison.
     * If t is larger than all tokens, we wrap and return 0.
     */
    private static int lowerBoundUnsigned(long[] arr, long t) {
        int lo = 0, hi = arr.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (Long.compareUnsigned(arr[mid], t) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo == arr.length ? 0 : lo;
    }
}
