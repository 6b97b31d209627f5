package io.blockring.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Identity of one block of one file-like object: the volume, the inode
 * (object id plus generation, allocated fresh on every rewrite) and the
 * block index within that inode.
 * <p>
 * Two equal refs name the same logical block in every ring version.
 */
public record BlockRef(long volumeId, long inodeId, long index) {

    /** Encoded length of {@link #toBytes()}. */
    public static final int BYTES = 3 * Long.BYTES;

    /**
     * Stable 24-byte big-endian encoding: volumeId, inodeId, index.
     * Hashing rings feed this to their hash function, so it must never change.
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES)
                .order(ByteOrder.BIG_ENDIAN)
                .putLong(volumeId)
                .putLong(inodeId)
                .putLong(index)
                .array();
    }

    @Override
    public String toString() {
        return "BlockRef[" + volumeId + ":" + inodeId + ":" + index + "]";
    }
}
