package io.blockring.core;

/** Optional ring capability: change the replication factor, keeping membership. */
public interface ModifyableRing {

    /** A new ring with the same members and {@code replication} as its factor. */
    Ring changeReplication(int replication) throws RingException;
}
