package com.shardmesh.core.shard;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Fields an update may replace. Null leaves the stored value alone.
 */
public record ShardPatch(ObjectNode structuredData, SyncStatus syncStatus, Instant lastSyncedAt) {

    public static ShardPatch synced(ObjectNode structuredData, Instant at) {
        return new ShardPatch(structuredData, SyncStatus.SYNCED, at);
    }
}
