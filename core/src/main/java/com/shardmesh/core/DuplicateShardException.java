package com.shardmesh.core;

import com.shardmesh.core.shard.DedupKey;

/**
 * A shard already exists for the dedup key of the shard being created.
 */
public class DuplicateShardException extends RuntimeException {
    private final DedupKey key;

    public DuplicateShardException(DedupKey key) {
        super("Shard already exists for " + key);
        this.key = key;
    }

    public DedupKey key() {
        return key;
    }
}
