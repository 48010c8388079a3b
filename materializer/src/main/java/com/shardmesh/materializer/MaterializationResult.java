package com.shardmesh.materializer;

import com.shardmesh.core.shard.Shard;

import java.util.List;

/**
 * What one batch call did. Lists follow the order of the input records; a record's derived shards come
 * right after its primary shard.
 */
public record MaterializationResult(
        List<ShardRef> created,
        List<ShardRef> updated,
        List<ShardRef> unchanged,
        List<Failure> failed,
        List<Edge> relationships,
        long durationMillis
) {
    public MaterializationResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        unchanged = List.copyOf(unchanged);
        failed = List.copyOf(failed);
        relationships = List.copyOf(relationships);
    }

    public record ShardRef(String id, String shardTypeId, String name, String externalId) {
        static ShardRef of(Shard shard) {
            return new ShardRef(shard.id(), shard.shardTypeId(), shard.name(), shard.externalId());
        }
    }

    public record Failure(String externalId, String reason) {}

    public record Edge(String source, String target, String type) {}
}
