package io.blockring.core;

import java.util.Objects;

/**
 * A storage peer as seen by placement: its id and its total capacity in blocks.
 * Produced by cluster membership; immutable once observed here.
 */
public record PeerInfo(String peerId, long totalBlocks) {

    public PeerInfo {
        Objects.requireNonNull(peerId, "peerId");
        if (peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
        if (totalBlocks < 0) throw new IllegalArgumentException("totalBlocks must be >= 0");
    }
}
