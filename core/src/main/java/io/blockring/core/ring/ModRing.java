package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PeerList;
import io.blockring.core.PeerPermutation;
import io.blockring.core.PlacementException;
import io.blockring.core.Ring;
import io.blockring.core.RingAdder;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingRemover;
import io.blockring.core.RingType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Modulo placement: members are sorted by id, and a block's permutation is that
 * sorted list rotated to start at {@code CRC32(block) mod n}.
 * <p>
 * Cheap and perfectly balanced, but almost every block moves when n changes.
 * Useful as a baseline for the rebalance planner.
 */
public final class ModRing extends AbstractRing implements RingAdder, RingRemover {

    private final PeerList sorted;

    public ModRing(int version, int replicationFactor, PeerInfoList peers) throws RingConstructionException {
        super(version, replicationFactor, peers);
        List<String> ids = new ArrayList<>(peers.peerList().asList());
        Collections.sort(ids);
        this.sorted = PeerList.copyOf(ids);
    }

    @Override
    public PeerPermutation getPeers(BlockRef block) throws PlacementException {
        int n = sorted.size();
        if (n == 0) {
            throw new PlacementException("mod ring v" + version + " has no peers for " + block);
        }
        CRC32 crc = new CRC32();
        crc.update(block.toBytes());
        int start = (int) (crc.getValue() % n);

        List<String> rotated = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rotated.add(sorted.get((start + i) % n));
        }
        return new PeerPermutation(effectiveReplication(n), PeerList.copyOf(rotated));
    }

    @Override
    public PeerList members() {
        return sorted;
    }

    @Override
    public RingType type() {
        return RingType.MOD;
    }

    @Override
    public Ring changeReplication(int replication) throws RingConstructionException {
        return new ModRing(version + 1, replication, peers);
    }

    @Override
    public Ring addPeers(PeerInfoList newPeers) throws RingConstructionException {
        return new ModRing(version + 1, replicationFactor, peers.union(newPeers));
    }

    @Override
    public Ring removePeers(PeerList goingAway) throws RingConstructionException {
        return new ModRing(version + 1, replicationFactor, peers.andNot(goingAway));
    }
}
