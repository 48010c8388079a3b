package com.shardmesh.core;

import com.shardmesh.core.shard.ShardRelationship;

import java.util.List;

public interface RelationshipRepository {
    ShardRelationship createRelationship(ShardRelationship relationship);
    List<ShardRelationship> findBySource(String tenantId, String sourceShardId);
    List<ShardRelationship> list(String tenantId);
}
