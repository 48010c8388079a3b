package com.shardmesh.core.shard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A directed, typed edge between two shards of the same tenant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShardRelationship(
        @JsonProperty("id") String id,
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("sourceShardId") String sourceShardId,
        @JsonProperty("targetShardId") String targetShardId,
        @JsonProperty("relationshipType") String relationshipType,
        @JsonProperty("sourceShardTypeId") String sourceShardTypeId,
        @JsonProperty("targetShardTypeId") String targetShardTypeId,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("metadata") ObjectNode metadata,
        @JsonProperty("createdAt") Instant createdAt
) {
    public static ShardRelationship link(String tenantId, Shard source, Shard target, String relationshipType,
                                         String createdBy, ObjectNode metadata) {
        return new ShardRelationship(null, tenantId, source.id(), target.id(), relationshipType,
                source.shardTypeId(), target.shardTypeId(), createdBy, metadata, null);
    }

    public ShardRelationship withId(String id, Instant createdAt) {
        return new ShardRelationship(id, tenantId, sourceShardId, targetShardId, relationshipType,
                sourceShardTypeId, targetShardTypeId, createdBy, metadata, createdAt);
    }

    public EdgeKey edgeKey() {
        return new EdgeKey(tenantId, sourceShardId, targetShardId, relationshipType);
    }

    public record EdgeKey(String tenantId, String sourceShardId, String targetShardId, String relationshipType) {}
}
