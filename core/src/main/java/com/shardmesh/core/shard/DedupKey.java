package com.shardmesh.core.shard;

/**
 * Identifies at most one shard: the same external record of the same integration, materialized as the same type.
 */
public record DedupKey(String tenantId, String integrationId, String externalId, String shardTypeId) {

    public static DedupKey of(Shard shard) {
        return new DedupKey(shard.tenantId(), shard.integrationId(), shard.externalId(), shard.shardTypeId());
    }
}
