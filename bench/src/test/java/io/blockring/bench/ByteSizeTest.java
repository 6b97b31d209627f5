package io.blockring.bench;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteSizeTest {

    @Test
    void parses_iec_and_si_units_case_insensitively() {
        assertEquals(262_144L, ByteSize.parse("256KiB"));
        assertEquals(1L << 40, ByteSize.parse("1TiB"));
        assertEquals(16L << 30, ByteSize.parse("16gib"));
        assertEquals(10_000_000L, ByteSize.parse("10MB"));
        assertEquals(1_500L, ByteSize.parse("1.5 kB"));
        assertEquals(512L, ByteSize.parse("512"));
        assertEquals(512L, ByteSize.parse("512B"));
        assertEquals(1024L, ByteSize.parse(" 1 Ki "));
    }

    @Test
    void rejects_malformed_sizes() {
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse("lots"));
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse("12 parsecs"));
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse("-5KiB"));
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse(null));
        assertThrows(IllegalArgumentException.class, () -> ByteSize.parse("99999PiB"));
    }

    @Test
    void formats_iec_with_one_decimal_below_ten() {
        assertEquals("0 B", ByteSize.formatIec(0));
        assertEquals("1023 B", ByteSize.formatIec(1023));
        assertEquals("1.0 KiB", ByteSize.formatIec(1024));
        assertEquals("1.5 KiB", ByteSize.formatIec(1536));
        assertEquals("256 KiB", ByteSize.formatIec(262_144));
        assertEquals("1.0 TiB", ByteSize.formatIec(1L << 40));
        assertEquals("16 GiB", ByteSize.formatIec(16L << 30));
    }
}
