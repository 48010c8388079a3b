package com.shardmesh.repositories.memory;

import com.fasterxml.uuid.Generators;
import com.shardmesh.core.DuplicateShardException;
import com.shardmesh.core.ShardNotFoundException;
import com.shardmesh.core.ShardRepository;
import com.shardmesh.core.shard.DedupKey;
import com.shardmesh.core.shard.Shard;
import com.shardmesh.core.shard.ShardPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Shard storage held in memory. A secondary index on the dedup key makes create-if-absent atomic:
 * two creates for the same key cannot both succeed.
 */
public class InMemoryShardRepository implements ShardRepository {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryShardRepository.class);

    private final Map<String, Shard> db = new ConcurrentHashMap<>();
    private final Map<DedupKey, String> externalIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<Shard> findByExternalId(String tenantId, String integrationId, String externalId, String shardTypeId) {
        String id = externalIndex.get(new DedupKey(tenantId, integrationId, externalId, shardTypeId));
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(db.get(id));
    }

    @Override
    public Optional<Shard> read(String id, String tenantId) {
        Shard shard = db.get(id);
        if (shard == null || !shard.tenantId().equals(tenantId)) {
            return Optional.empty();
        }
        return Optional.of(shard);
    }

    @Override
    public Shard create(Shard shard) {
        String id = shard.id() != null ? shard.id() : Generators.timeBasedGenerator().generate().toString();
        Shard stored = shard.withId(id, Instant.now());

        boolean indexed = false;
        if (shard.externalId() != null) {
            if (externalIndex.putIfAbsent(stored.dedupKey(), id) != null) {
                throw new DuplicateShardException(stored.dedupKey());
            }
            indexed = true;
        }
        if (db.putIfAbsent(id, stored) != null) {
            if (indexed) {
                externalIndex.remove(stored.dedupKey(), id);
            }
            throw new IllegalStateException("Shard " + id + " already exists");
        }

        logger.debug("Created shard {} ({}) for external id {}", id, stored.shardTypeId(), stored.externalId());
        return stored;
    }

    @Override
    public Shard update(String id, String tenantId, ShardPatch patch) {
        Shard updated = db.computeIfPresent(id, (key, existing) ->
                existing.tenantId().equals(tenantId) ? existing.apply(patch, Instant.now()) : existing);

        if (updated == null || !updated.tenantId().equals(tenantId)) {
            throw new ShardNotFoundException("Shard " + id + " not found for tenant " + tenantId);
        }
        return updated;
    }

    @Override
    public List<Shard> list(String tenantId) {
        return db.values().stream()
                .filter(s -> s.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Shard::createdAt).thenComparing(Shard::id))
                .collect(Collectors.toList());
    }
}
