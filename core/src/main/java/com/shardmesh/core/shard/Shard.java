package com.shardmesh.core.shard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Shard(
        @JsonProperty("id") String id,
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("shardTypeId") String shardTypeId,
        @JsonProperty("name") String name,
        @JsonProperty("integrationId") String integrationId,
        @JsonProperty("externalId") String externalId,
        @JsonProperty("structuredData") ObjectNode structuredData,
        @JsonProperty("source") ShardSource source,
        @JsonProperty("syncStatus") SyncStatus syncStatus,
        @JsonProperty("lastSyncedAt") Instant lastSyncedAt,
        @JsonProperty("metadata") ObjectNode metadata,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt
) {
    public Shard withId(String id, Instant createdAt) {
        return new Shard(id, tenantId, shardTypeId, name, integrationId, externalId, structuredData, source,
                syncStatus, lastSyncedAt, metadata, createdBy, createdAt, createdAt);
    }

    public Shard apply(ShardPatch patch, Instant now) {
        return new Shard(
                id,
                tenantId,
                shardTypeId,
                name,
                integrationId,
                externalId,
                patch.structuredData() != null ? patch.structuredData() : structuredData,
                source,
                patch.syncStatus() != null ? patch.syncStatus() : syncStatus,
                patch.lastSyncedAt() != null ? patch.lastSyncedAt() : lastSyncedAt,
                metadata,
                createdBy,
                createdAt,
                now);
    }

    public DedupKey dedupKey() {
        return DedupKey.of(this);
    }
}
