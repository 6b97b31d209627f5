package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PeerList;
import io.blockring.core.PeerPermutation;
import io.blockring.core.PlacementException;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingType;

/** A ring with no members. Every placement query fails. */
public final class EmptyRing extends AbstractRing {

    public EmptyRing(int version, int replicationFactor) throws RingConstructionException {
        super(version, replicationFactor, PeerInfoList.empty());
    }

    @Override
    public PeerPermutation getPeers(BlockRef block) throws PlacementException {
        throw new PlacementException("empty ring v" + version + " has no peers for " + block);
    }

    @Override
    public PeerList members() {
        return PeerList.empty();
    }

    @Override
    public RingType type() {
        return RingType.EMPTY;
    }
}
