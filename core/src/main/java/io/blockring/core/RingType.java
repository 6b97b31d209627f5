package io.blockring.core;

import java.util.Locale;

/** Kinds of ring implementation known to the ring factory. */
public enum RingType {
    /** No members; every placement query fails. */
    EMPTY,
    /** Exactly one member holding every block. */
    SINGLE,
    /** Sorted members rotated by a CRC32 of the block. */
    MOD,
    /** Consistent hashing with capacity-weighted virtual nodes. */
    KETAMA;

    /**
     * Parse a ring kind by name, ignoring case ({@code "mod"}, {@code "ketama"}, ...).
     */
    public static RingType parse(String name) throws UnknownRingTypeException {
        if (name == null || name.isBlank()) {
            throw new UnknownRingTypeException(String.valueOf(name));
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownRingTypeException(name);
        }
    }

    /** Lower-case name as accepted by {@link #parse(String)}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
