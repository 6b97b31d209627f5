package io.blockring.bench;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-readable byte sizes.
 * <p>
 * Parsing accepts SI ({@code kB}, {@code MB}, ... powers of 1000) and IEC
 * ({@code KiB}, {@code MiB}, ... powers of 1024) suffixes, case-insensitive,
 * with an optional fraction: {@code 512}, {@code 256KiB}, {@code 1.5 GB}.
 * Formatting is always IEC: {@code 256 KiB}, {@code 1.5 TiB}.
 */
final class ByteSize {

    private static final Pattern SIZE = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*([a-zA-Z]*)\\s*$");

    private static final Map<String, Double> UNITS = Map.ofEntries(
            Map.entry("", 1.0),
            Map.entry("b", 1.0),
            Map.entry("k", 1e3), Map.entry("kb", 1e3),
            Map.entry("m", 1e6), Map.entry("mb", 1e6),
            Map.entry("g", 1e9), Map.entry("gb", 1e9),
            Map.entry("t", 1e12), Map.entry("tb", 1e12),
            Map.entry("p", 1e15), Map.entry("pb", 1e15),
            Map.entry("ki", 0x1p10), Map.entry("kib", 0x1p10),
            Map.entry("mi", 0x1p20), Map.entry("mib", 0x1p20),
            Map.entry("gi", 0x1p30), Map.entry("gib", 0x1p30),
            Map.entry("ti", 0x1p40), Map.entry("tib", 0x1p40),
            Map.entry("pi", 0x1p50), Map.entry("pib", 0x1p50)
    );

    private static final String[] IEC = {"B", "KiB", "MiB", "GiB", "TiB", "PiB", "EiB"};

    private ByteSize() {
        // utility
    }

    /**
     * Parse a size string into bytes.
     *
     * @throws IllegalArgumentException on an unknown unit, a malformed number, or a size beyond {@code Long.MAX_VALUE}
     */
    static long parse(String s) {
        if (s == null) throw new IllegalArgumentException("size is null");
        Matcher m = SIZE.matcher(s);
        if (!m.matches()) {
            throw new IllegalArgumentException("malformed size: \"" + s + "\"");
        }
        Double mult = UNITS.get(m.group(2).toLowerCase(Locale.ROOT));
        if (mult == null) {
            throw new IllegalArgumentException("unknown unit \"" + m.group(2) + "\" in \"" + s + "\"");
        }
        double bytes = Double.parseDouble(m.group(1)) * mult;
        if (bytes >= 0x1p63) {
            throw new IllegalArgumentException("size too large: \"" + s + "\"");
        }
        return Math.round(bytes);
    }

    /** IEC rendering, one decimal below 10 units: {@code 1023 B}, {@code 1.5 KiB}, {@code 256 KiB}. */
    static String formatIec(long bytes) {
        if (bytes < 0) throw new IllegalArgumentException("bytes must be >= 0");
        if (bytes < 1024) {
            return bytes + " B";
        }
        int e = 0;
        while (e < IEC.length - 1 && bytes >= (1L << (10 * (e + 1)))) {
            e++;
        }
        double val = Math.floor(bytes / Math.pow(1024, e) * 10 + 0.5) / 10;
        String fmt = val < 10 ? "%.1f %s" : "%.0f %s";
        return String.format(Locale.ROOT, fmt, val, IEC[e]);
    }
}
