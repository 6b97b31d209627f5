package io.blockring.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable list of peer descriptors, in insertion order (not placement rank).
 * <p>
 * Set operations mirror {@link PeerList} and compare descriptors by peer id only.
 */
public final class PeerInfoList implements Iterable<PeerInfo> {
    private static final Logger log = Logger.getLogger(PeerInfoList.class.getName());

    private static final PeerInfoList EMPTY = new PeerInfoList(List.of());

    private final List<PeerInfo> peers;

    private PeerInfoList(List<PeerInfo> peers) {
        this.peers = peers;
    }

    public static PeerInfoList empty() {
        return EMPTY;
    }

    public static PeerInfoList of(PeerInfo... peers) {
        return copyOf(List.of(peers));
    }

    public static PeerInfoList copyOf(Collection<PeerInfo> peers) {
        Objects.requireNonNull(peers, "peers");
        if (peers.isEmpty()) return EMPTY;
        return new PeerInfoList(List.copyOf(peers));
    }

    public int size() {
        return peers.size();
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }

    public PeerInfo get(int index) {
        return peers.get(index);
    }

    public List<PeerInfo> asList() {
        return peers;
    }

    /** Position of the descriptor with this peer id, or -1. */
    public int indexOf(String peerId) {
        for (int i = 0; i < peers.size(); i++) {
            if (peers.get(i).peerId().equals(peerId)) {
                return i;
            }
        }
        return -1;
    }

    public boolean has(String peerId) {
        return indexOf(peerId) != -1;
    }

    /** Descriptors whose id is not in {@code ids}, in this list's order. */
    public PeerInfoList andNot(PeerList ids) {
        List<PeerInfo> out = new ArrayList<>(peers.size());
        for (PeerInfo p : peers) {
            if (!ids.has(p.peerId())) {
                out.add(p);
            }
        }
        return copyOf(out);
    }

    /** This list, then descriptors of {@code other} whose id is not already present. */
    public PeerInfoList union(PeerInfoList other) {
        List<PeerInfo> out = new ArrayList<>(peers.size() + other.size());
        out.addAll(peers);
        for (PeerInfo p : other) {
            if (!has(p.peerId())) {
                out.add(p);
            }
        }
        return copyOf(out);
    }

    /** Descriptors of this list whose id also appears in {@code other}. */
    public PeerInfoList intersect(PeerInfoList other) {
        List<PeerInfo> out = new ArrayList<>(Math.min(peers.size(), other.size()));
        for (PeerInfo p : peers) {
            if (other.has(p.peerId())) {
                out.add(p);
            }
        }
        return copyOf(out);
    }

    /** Project to plain peer ids, order preserved. */
    public PeerList peerList() {
        List<String> out = new ArrayList<>(peers.size());
        for (PeerInfo p : peers) {
            out.add(p.peerId());
        }
        return PeerList.copyOf(out);
    }

    /**
     * Integer placement weight per peer: capacity divided by the GCD of all
     * capacities. Capacities {100, 200, 300} give weights {1, 2, 3}.
     * <p>
     * A zero capacity next to non-zero ones gets weight 0 (gcd(x, 0) = x).
     *
     * @return peer id to weight, in list order; empty for an empty list
     * @throws CapacityWeightUndefinedException if every capacity is zero
     */
    public Map<String, Long> weights() throws CapacityWeightUndefinedException {
        if (peers.isEmpty()) {
            return Map.of();
        }
        BigInteger gcd = BigInteger.valueOf(peers.get(0).totalBlocks());
        for (int i = 1; i < peers.size(); i++) {
            gcd = gcd.gcd(BigInteger.valueOf(peers.get(i).totalBlocks()));
        }
        if (gcd.signum() == 0) {
            throw new CapacityWeightUndefinedException(peers.size());
        }

        long divisor = gcd.longValueExact();
        Map<String, Long> out = new LinkedHashMap<>();
        for (PeerInfo p : peers) {
            long weight = p.totalBlocks() / divisor;
            out.put(p.peerId(), weight);
            log.log(Level.FINE, "{0}: weight {1}", new Object[]{p.peerId(), weight});
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public Iterator<PeerInfo> iterator() {
        return peers.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerInfoList other)) return false;
        return peers.equals(other.peers);
    }

    @Override
    public int hashCode() {
        return peers.hashCode();
    }

    @Override
    public String toString() {
        return peers.toString();
    }
}
