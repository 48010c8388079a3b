package com.shardmesh.core;

import com.shardmesh.core.shard.Shard;
import com.shardmesh.core.shard.ShardPatch;

import java.util.List;
import java.util.Optional;

public interface ShardRepository {
    Optional<Shard> findByExternalId(String tenantId, String integrationId, String externalId, String shardTypeId);
    Optional<Shard> read(String id, String tenantId);
    Shard create(Shard shard);
    Shard update(String id, String tenantId, ShardPatch patch);
    List<Shard> list(String tenantId);
}
