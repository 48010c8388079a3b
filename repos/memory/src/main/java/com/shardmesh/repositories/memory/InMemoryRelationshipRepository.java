package com.shardmesh.repositories.memory;

import com.fasterxml.uuid.Generators;
import com.shardmesh.core.RelationshipRepository;
import com.shardmesh.core.shard.ShardRelationship;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Edges held in memory, one per (tenant, source, target, type). Linking an existing edge again replaces
 * its metadata and keeps its id.
 */
public class InMemoryRelationshipRepository implements RelationshipRepository {
    private final Map<ShardRelationship.EdgeKey, ShardRelationship> db = new ConcurrentHashMap<>();

    @Override
    public ShardRelationship createRelationship(ShardRelationship relationship) {
        return db.compute(relationship.edgeKey(), (key, existing) -> {
            if (existing != null) {
                return relationship.withId(existing.id(), existing.createdAt());
            }
            return relationship.withId(Generators.timeBasedGenerator().generate().toString(), Instant.now());
        });
    }

    @Override
    public List<ShardRelationship> findBySource(String tenantId, String sourceShardId) {
        return db.values().stream()
                .filter(r -> r.tenantId().equals(tenantId) && r.sourceShardId().equals(sourceShardId))
                .sorted(Comparator.comparing(ShardRelationship::createdAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<ShardRelationship> list(String tenantId) {
        return db.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(ShardRelationship::createdAt))
                .collect(Collectors.toList());
    }
}
