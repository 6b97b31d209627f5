package io.blockring.core.ring;

import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.Ring;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingException;
import io.blockring.core.RingType;

import java.util.HashSet;
import java.util.Set;

/**
 * State shared by the built-in rings: type, version, configured replication and
 * the peer descriptors the ring was built from. Immutable.
 */
abstract class AbstractRing implements Ring {

    protected final int version;
    protected final int replicationFactor;
    protected final PeerInfoList peers;

    protected AbstractRing(int version, int replicationFactor, PeerInfoList peers) throws RingConstructionException {
        validate(replicationFactor, peers);
        this.version = version;
        this.replicationFactor = replicationFactor;
        this.peers = peers;
    }

    /** Reject negative replication and duplicate peer ids. */
    static void validate(int replicationFactor, PeerInfoList peers) throws RingConstructionException {
        if (replicationFactor < 0) {
            throw new RingConstructionException("replication factor must be >= 0, got " + replicationFactor);
        }
        Set<String> seen = new HashSet<>(peers.size());
        for (PeerInfo p : peers) {
            if (!seen.add(p.peerId())) {
                throw new RingConstructionException("duplicate peer id: " + p.peerId());
            }
        }
    }

    @Override
    public int version() {
        return version;
    }

    /** Replication reported by placement queries over {@code available} peers. */
    protected int effectiveReplication(int available) {
        return Math.min(replicationFactor, available);
    }

    RingDescriptor descriptor() {
        return RingDescriptor.of(type(), version, replicationFactor, peers);
    }

    @Override
    public byte[] marshal() throws RingException {
        return Rings.encode(descriptor());
    }

    @Override
    public String describe() {
        RingType t = type();
        return "%s ring v%d: %d peers, replication %d".formatted(
                t.label(), version, members().size(), replicationFactor);
    }

    @Override
    public String toString() {
        return describe();
    }
}
