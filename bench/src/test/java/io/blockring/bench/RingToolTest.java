package io.blockring.bench;

import io.blockring.core.PlacementException;
import io.blockring.core.RingAdder;
import io.blockring.core.RingType;
import io.blockring.core.rebalance.RebalanceStats;
import io.blockring.core.ring.ModRing;
import io.blockring.core.ring.SingleRing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the simulator on small workloads.
 */
class RingToolTest {

    @TempDir
    Path tmp;

    private static RingToolConfig config(String... args) {
        return RingToolConfig.fromArgs(args);
    }

    private static String runAndCapture(RingToolConfig cfg) throws Exception {
        var buf = new ByteArrayOutputStream();
        try (var out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            RingTool.run(cfg, out);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void growing_mod_ring_reports_balance_and_changes() throws Exception {
        var cfg = config("--ring", "mod", "--nodes", "3", "--delta", "2",
                "--block-size", "4KiB", "--total-data", "16MiB");

        String report = runAndCapture(cfg);

        assertTrue(report.contains("Unique blocks: "));
        assertTrue(report.contains("@START *****"));
        assertTrue(report.contains("@END *****"));
        assertTrue(report.contains("Blocks Kept: "));
        assertTrue(report.contains("Blocks Sent: "));
        assertTrue(report.contains("Percentage Sent: "));
        assertTrue(report.contains("Perfect Traffic: "));
    }

    @Test
    void growing_ring_is_derived_through_the_adder() throws Exception {
        var cfg = config("--ring", "ketama", "--nodes", "4", "--delta", "1", "--rep", "2", "--rep-end", "3");
        var peers = RingTool.buildPeers(cfg, new Random(1));

        var rings = RingTool.createRings(cfg, peers);

        assertEquals(4, rings.from().members().size());
        assertEquals(5, rings.to().members().size());
        assertEquals(1, rings.from().version());
        assertEquals(3, rings.to().version(), "add then change replication");
        assertEquals(RingType.KETAMA, rings.to().type());
    }

    @Test
    void shrinking_removes_the_tail_of_the_starting_peers() throws Exception {
        var cfg = config("--ring", "mod", "--nodes", "5", "--delta", "-2");
        var peers = RingTool.buildPeers(cfg, new Random(1));

        var rings = RingTool.createRings(cfg, peers);

        assertEquals(5, peers.size());
        assertInstanceOf(ModRing.class, rings.to());
        assertEquals(3, rings.to().members().size());
        assertFalse(rings.to().members().has(peers.get(3).peerId()));
        assertFalse(rings.to().members().has(peers.get(4).peerId()));
    }

    @Test
    void ring_without_capabilities_gets_a_fresh_target() throws Exception {
        var cfg = config("--ring", "single", "--nodes", "1", "--delta", "0", "--rep", "1");
        var peers = RingTool.buildPeers(cfg, new Random(1));

        var rings = RingTool.createRings(cfg, peers);

        assertInstanceOf(SingleRing.class, rings.to());
        assertFalse(rings.from() instanceof RingAdder);
        assertEquals(2, rings.to().version());
    }

    @Test
    void rebalance_from_identical_rings_sends_nothing() throws Exception {
        var cfg = config("--ring", "single", "--nodes", "1", "--delta", "0", "--rep", "1",
                "--block-size", "4KiB", "--total-data", "4MiB");

        var result = RingTool.run(cfg, new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertEquals(0, result.stats().blocksSent());
        assertTrue(result.stats().blocksKept() >= 1024);
    }

    @Test
    void empty_ring_fails_the_run() {
        var cfg = config("--ring", "empty", "--nodes", "0", "--delta", "0",
                "--block-size", "4KiB", "--total-data", "64KiB");

        assertThrows(PlacementException.class,
                () -> RingTool.run(cfg, new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)));
    }

    @Test
    void peers_file_supplies_capacities() throws Exception {
        Path path = tmp.resolve("peers.json");
        Files.writeString(path, """
                {"peers": [
                  {"peerId": "a", "totalBlocks": 100},
                  {"peerId": "b", "totalBlocks": 200},
                  {"peerId": "c", "totalBlocks": 100}
                ]}
                """);
        var cfg = config("--ring", "ketama", "--nodes", "2", "--delta", "1", "--peers", path.toString());

        var peers = RingTool.buildPeers(cfg, new Random(1));
        assertEquals(3, peers.size());
        assertEquals("b", peers.get(1).peerId());

        var tooMany = config("--ring", "ketama", "--nodes", "3", "--delta", "2", "--peers", path.toString());
        assertThrows(CliException.class, () -> RingTool.buildPeers(tooMany, new Random(1)));
    }

    @Test
    void perfect_traffic_is_the_delta_share_of_all_data() {
        var cfg = config("--nodes", "3", "--delta", "1", "--block-size", "1KiB");
        var stats = new RebalanceStats(300, 100);

        assertEquals(400L * 1024 / 4, RingTool.perfectTraffic(stats, cfg));
    }
}
