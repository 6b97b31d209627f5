package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.CapacityWeightUndefinedException;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PeerList;
import io.blockring.core.PlacementException;
import io.blockring.core.RingConstructionException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class HashRingTest {

    private static PeerInfoList peers(String... ids) {
        return PeerInfoList.copyOf(Arrays.stream(ids).map(id -> new PeerInfo(id, 1000)).toList());
    }

    private static BlockRef block(int i) {
        return new BlockRef(1, i / 64, i % 64);
    }

    @Test
    void determinism_same_inputs_same_owners() throws Exception {
        var ring1 = HashRing.build(1, 3, peers("A", "B", "C"));
        var ring2 = HashRing.build(1, 3, peers("A", "B", "C"));

        for (int i = 0; i < 100; i++) {
            assertEquals(ring1.getPeers(block(i)), ring2.getPeers(block(i)));
            assertEquals(ring1.getPeers(block(i)), ring1.getPeers(block(i)));
        }
    }

    @Test
    void balance_first_owner_share_is_roughly_uniform() throws Exception {
        var ring = HashRing.build(1, 1, peers("A", "B", "C"));
        var counts = new HashMap<String, Integer>();

        int n = 60_000;
        for (int i = 0; i < n; i++) {
            String first = ring.getPeers(block(i)).peers().get(0);
            counts.merge(first, 1, Integer::sum);
        }
        // ~33% each, allow ±7%
        for (String p : List.of("A", "B", "C")) {
            double share = counts.getOrDefault(p, 0) / (double) n;
            assertTrue(Math.abs(share - 1.0 / 3) < 0.07, p + " share=" + share);
        }
    }

    @Test
    void heavier_peer_owns_proportionally_more() throws Exception {
        var ring = HashRing.build(1, 1, PeerInfoList.of(
                new PeerInfo("small", 100),
                new PeerInfo("big", 300)));

        int n = 40_000, big = 0;
        for (int i = 0; i < n; i++) {
            if (ring.getPeers(block(i)).peers().get(0).equals("big")) big++;
        }
        double share = big / (double) n;
        // ~75%
        assertTrue(share > 0.65 && share < 0.85, "big share=" + share);
    }

    @Test
    void movement_on_join_is_about_quarter() throws Exception {
        var rOld = HashRing.build(1, 1, peers("A", "B", "C"));
        var rNew = rOld.addPeers(peers("D"));

        int n = 40_000, moved = 0;
        for (int i = 0; i < n; i++) {
            String oldOwner = rOld.getPeers(block(i)).peers().get(0);
            String newOwner = rNew.getPeers(block(i)).peers().get(0);
            if (!oldOwner.equals(newOwner)) {
                moved++;
                assertEquals("D", newOwner, "blocks only move to the joining peer");
            }
        }
        double frac = moved / (double) n;
        assertTrue(frac > 0.15 && frac < 0.35, "moved=" + frac);
    }

    @Test
    void permutation_lists_every_member_once() throws Exception {
        var ring = HashRing.build(1, 2, peers("A", "B", "C", "D"));
        var perm = ring.getPeers(block(7));

        assertEquals(4, perm.peers().size());
        assertEquals(4, new HashSet<>(perm.peers().asList()).size());
        assertEquals(2, perm.holders().size());
    }

    @Test
    void edge_cases() throws Exception {
        var ring = HashRing.build(1, 3, peers("A", "B"));
        // more replicas than members: capped
        assertEquals(2, ring.getPeers(block(1)).replication());

        var empty = HashRing.build(1, 3, PeerInfoList.empty());
        assertThrows(PlacementException.class, () -> empty.getPeers(block(1)));

        assertThrows(CapacityWeightUndefinedException.class, () -> HashRing.build(1, 1, PeerInfoList.of(
                new PeerInfo("A", 0), new PeerInfo("B", 0))));
        assertThrows(RingConstructionException.class, () -> HashRing.build(1, 1, peers("A"), 0));
        assertThrows(RingConstructionException.class, () -> HashRing.build(1, 1, peers("A", "A")));
    }

    @Test
    void zero_capacity_peer_is_a_member_but_never_placed() throws Exception {
        var ring = HashRing.build(1, 2, PeerInfoList.of(
                new PeerInfo("full", 0),
                new PeerInfo("B", 500),
                new PeerInfo("C", 500)));

        assertEquals(PeerList.of("full", "B", "C"), ring.members());
        for (int i = 0; i < 100; i++) {
            var perm = ring.getPeers(block(i));
            assertFalse(perm.peers().has("full"));
            assertEquals(2, perm.replication());
        }
    }

    @Test
    void spread_needing_too_many_tokens_is_rejected() {
        var peers = PeerInfoList.of(new PeerInfo("tiny", 1), new PeerInfo("huge", 1L << 40));

        assertThrows(RingConstructionException.class, () -> HashRing.build(1, 1, peers));
    }

    @Test
    void spread_beyond_long_range_is_rejected_without_overflow() {
        var peers = PeerInfoList.of(new PeerInfo("tiny", 1), new PeerInfo("huge", 100_000_000_000_000_000L));

        assertThrows(RingConstructionException.class, () -> HashRing.build(1, 1, peers));
    }
}
