package io.blockring.core.ring;

import io.blockring.core.BlockRef;
import io.blockring.core.ModifyableRing;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.PlacementException;
import io.blockring.core.Ring;
import io.blockring.core.RingAdder;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingRemover;
import io.blockring.core.RingType;
import io.blockring.core.UnknownRingTypeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Factory, codec and capability probing across all built-in ring kinds.
 */
class RingsTest {

    private static final PeerInfoList PEERS = PeerInfoList.of(
            new PeerInfo("alpha", 100),
            new PeerInfo("bravo", 200),
            new PeerInfo("charlie", 100));

    @Test
    void ring_type_parses_case_insensitively() throws Exception {
        assertEquals(RingType.MOD, RingType.parse("mod"));
        assertEquals(RingType.KETAMA, RingType.parse(" Ketama "));
        assertEquals("single", RingType.SINGLE.label());
        assertThrows(UnknownRingTypeException.class, () -> RingType.parse("chord"));
        assertThrows(UnknownRingTypeException.class, () -> RingType.parse(""));
        assertThrows(UnknownRingTypeException.class, () -> RingType.parse(null));
    }

    @Test
    void create_builds_each_kind() throws Exception {
        assertInstanceOf(ModRing.class, Rings.create(RingDescriptor.of(RingType.MOD, 1, 2, PEERS)));
        assertInstanceOf(HashRing.class, Rings.create(RingDescriptor.of(RingType.KETAMA, 1, 2, PEERS)));
        assertInstanceOf(EmptyRing.class, Rings.create(RingDescriptor.of(RingType.EMPTY, 1, 2, PeerInfoList.empty())));
        assertInstanceOf(SingleRing.class, Rings.create(RingDescriptor.of(
                RingType.SINGLE, 1, 1, PeerInfoList.of(new PeerInfo("solo", 10)))));
    }

    @Test
    void create_rejects_peer_counts_the_kind_cannot_hold() {
        assertThrows(RingConstructionException.class,
                () -> Rings.create(RingDescriptor.of(RingType.EMPTY, 1, 1, PEERS)));
        assertThrows(RingConstructionException.class,
                () -> Rings.create(RingDescriptor.of(RingType.SINGLE, 1, 1, PEERS)));
        assertThrows(RingConstructionException.class,
                () -> Rings.create(RingDescriptor.of(RingType.MOD, 1, -2, PEERS)));
    }

    @Test
    void marshal_round_trips_to_an_equivalent_ring() throws Exception {
        for (RingType type : List.of(RingType.MOD, RingType.KETAMA)) {
            Ring ring = Rings.create(new RingDescriptor(type, 7, 2, 64, PEERS.asList()));

            Ring copy = Rings.unmarshal(ring.marshal());

            assertEquals(ring.type(), copy.type());
            assertEquals(ring.version(), copy.version());
            assertEquals(ring.members(), copy.members());
            assertEquals(ring.describe(), copy.describe());
            for (int i = 0; i < 200; i++) {
                var b = new BlockRef(3, i, i % 5);
                assertEquals(ring.getPeers(b), copy.getPeers(b));
            }
        }
    }

    @Test
    void marshal_round_trips_single_and_empty() throws Exception {
        Ring single = new SingleRing(2, new PeerInfo("solo", 10));
        Ring copy = Rings.unmarshal(single.marshal());
        assertEquals(single.getPeers(new BlockRef(1, 1, 1)), copy.getPeers(new BlockRef(1, 1, 1)));

        Ring empty = Rings.unmarshal(new EmptyRing(4, 3).marshal());
        assertEquals(RingType.EMPTY, empty.type());
        assertEquals(4, empty.version());
        assertThrows(PlacementException.class, () -> empty.getPeers(new BlockRef(1, 1, 1)));
    }

    @Test
    void unmarshal_rejects_garbage() {
        assertThrows(RingConstructionException.class,
                () -> Rings.unmarshal("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(RingConstructionException.class,
                () -> Rings.unmarshal("null".getBytes(StandardCharsets.UTF_8)));
        assertThrows(RingConstructionException.class,
                () -> Rings.unmarshal("{\"type\":\"CHORD\"}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(RingConstructionException.class,
                () -> Rings.unmarshal("{\"type\":\"MOD\",\"peers\":[{\"peerId\":\"\",\"totalBlocks\":1}]}"
                        .getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void capabilities_are_probed_not_assumed() throws Exception {
        Ring mod = Rings.create(RingDescriptor.of(RingType.MOD, 1, 2, PEERS));
        Ring single = Rings.create(RingDescriptor.of(RingType.SINGLE, 1, 1, PeerInfoList.of(new PeerInfo("solo", 1))));
        Ring empty = new EmptyRing(1, 1);

        assertTrue(mod instanceof RingAdder);
        assertTrue(mod instanceof RingRemover);
        assertTrue(mod instanceof ModifyableRing);
        assertFalse(single instanceof ModifyableRing);
        assertFalse(empty instanceof RingAdder);
        assertFalse(empty instanceof RingRemover);
    }

    @Test
    void every_kind_honours_replication_bounds() throws Exception {
        for (RingType type : List.of(RingType.MOD, RingType.KETAMA, RingType.SINGLE)) {
            PeerInfoList peers = type == RingType.SINGLE ? PeerInfoList.of(new PeerInfo("solo", 1)) : PEERS;
            Ring ring = Rings.create(RingDescriptor.of(type, 1, 5, peers));
            for (int i = 0; i < 100; i++) {
                var perm = ring.getPeers(new BlockRef(1, i, 0));
                assertTrue(perm.peers().size() >= perm.replication(), type + ": peers >= replication");
                assertTrue(perm.replication() <= ring.members().size(), type + ": replication <= members");
            }
        }
    }
}
