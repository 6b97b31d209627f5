package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PeerList;
import io.blockring.core.PeerPermutation;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingType;

/** One peer holds every block. Replication is always 1. */
public final class SingleRing extends AbstractRing {

    private final PeerList members;
    private final PeerPermutation permutation;

    public SingleRing(int version, PeerInfo peer) throws RingConstructionException {
        super(version, 1, PeerInfoList.of(peer));
        this.members = PeerList.of(peer.peerId());
        this.permutation = new PeerPermutation(1, members);
    }

    @Override
    public PeerPermutation getPeers(BlockRef block) {
        return permutation;
    }

    @Override
    public PeerList members() {
        return members;
    }

    @Override
    public RingType type() {
        return RingType.SINGLE;
    }
}
