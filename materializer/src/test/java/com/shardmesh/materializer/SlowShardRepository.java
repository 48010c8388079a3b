package com.shardmesh.materializer;

import com.shardmesh.core.shard.Shard;
import com.shardmesh.repositories.memory.InMemoryShardRepository;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory shards whose lookups and creates take a while, to widen race windows and trip storage timeouts.
 */
class SlowShardRepository extends InMemoryShardRepository {
    private final Duration lookupDelay;
    private final Duration createDelay;

    SlowShardRepository(Duration lookupDelay) {
        this(lookupDelay, Duration.ZERO);
    }

    SlowShardRepository(Duration lookupDelay, Duration createDelay) {
        this.lookupDelay = lookupDelay;
        this.createDelay = createDelay;
    }

    @Override
    public Optional<Shard> findByExternalId(String tenantId, String integrationId, String externalId, String shardTypeId) {
        pause(lookupDelay, "lookup");
        return super.findByExternalId(tenantId, integrationId, externalId, shardTypeId);
    }

    @Override
    public Shard create(Shard shard) {
        pause(createDelay, "create");
        return super.create(shard);
    }

    private static void pause(Duration delay, String operation) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operation + " interrupted", e);
        }
    }
}
