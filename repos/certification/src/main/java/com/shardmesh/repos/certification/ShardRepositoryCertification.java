package com.shardmesh.repos.certification;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.core.DuplicateShardException;
import com.shardmesh.core.ShardNotFoundException;
import com.shardmesh.core.ShardRepository;
import com.shardmesh.core.shard.Shard;
import com.shardmesh.core.shard.ShardPatch;
import com.shardmesh.core.shard.ShardSource;
import com.shardmesh.core.shard.SyncStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public abstract class ShardRepositoryCertification {
    protected ShardRepository repository;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    protected static Shard shard(String tenantId, String externalId, String shardTypeId, String name) {
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("name", name);
        return new Shard(null, tenantId, shardTypeId, name, "crm", externalId, data, ShardSource.INTEGRATION,
                SyncStatus.SYNCED, Instant.now(), JsonNodeFactory.instance.objectNode(), "system", null, null);
    }

    @Test
    public void createShouldAssignIdAndTimestamps() {
        Instant before = Instant.now();

        Shard created = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));

        assertNotNull(created.id());
        assertNotNull(created.createdAt());
        assertFalse(created.createdAt().isBefore(before));
        assertEquals("Acme", created.name());
    }

    @Test
    public void findByExternalIdShouldMatchTheWholeDedupKey() {
        Shard created = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));

        Optional<Shard> found = repository.findByExternalId("tenant-a", "crm", "acc-1", "account");
        assertTrue(found.isPresent());
        assertEquals(created.id(), found.get().id());

        assertTrue(repository.findByExternalId("tenant-b", "crm", "acc-1", "account").isEmpty());
        assertTrue(repository.findByExternalId("tenant-a", "erp", "acc-1", "account").isEmpty());
        assertTrue(repository.findByExternalId("tenant-a", "crm", "acc-1", "contact").isEmpty());
    }

    @Test
    public void createShouldRejectASecondShardForTheSameDedupKey() {
        repository.create(shard("tenant-a", "acc-1", "account", "Acme"));

        assertThrows(DuplicateShardException.class,
                () -> repository.create(shard("tenant-a", "acc-1", "account", "Acme again")));
        assertEquals(1, repository.list("tenant-a").size());
    }

    @Test
    public void createShouldNeverReplaceAShardWithTheSameId() {
        Shard first = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));
        Shard clash = shard("tenant-a", "acc-2", "account", "Globex").withId(first.id(), Instant.now());

        assertThrows(RuntimeException.class, () -> repository.create(clash));

        assertEquals("Acme", repository.read(first.id(), "tenant-a").orElseThrow().name());
        assertTrue(repository.findByExternalId("tenant-a", "crm", "acc-2", "account").isEmpty());
        assertEquals(1, repository.list("tenant-a").size());
        assertNotNull(repository.create(shard("tenant-a", "acc-2", "account", "Globex")).id());
    }

    @Test
    public void duplicateCreateWithAnExistingIdShouldLeaveTheOriginalInPlace() {
        Shard first = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));
        Shard again = shard("tenant-a", "acc-1", "account", "Acme again").withId(first.id(), Instant.now());

        assertThrows(DuplicateShardException.class, () -> repository.create(again));

        assertEquals("Acme", repository.read(first.id(), "tenant-a").orElseThrow().name());
        assertEquals(1, repository.list("tenant-a").size());
    }

    @Test
    public void concurrentCreatesForOneKeyShouldStoreExactlyOneShard() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String name = "writer-" + i;
                Callable<Boolean> create = () -> {
                    start.await();
                    try {
                        repository.create(shard("tenant-a", "acc-1", "account", name));
                        return true;
                    } catch (DuplicateShardException e) {
                        return false;
                    }
                };
                results.add(pool.submit(create));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertEquals(1, successes);
            assertEquals(1, repository.list("tenant-a").size());
        } catch (ExecutionException e) {
            fail(e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void readShouldBeTenantScoped() {
        Shard created = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));

        assertTrue(repository.read(created.id(), "tenant-a").isPresent());
        assertTrue(repository.read(created.id(), "tenant-b").isEmpty());
    }

    @Test
    public void updateShouldReplaceStructuredDataAndSyncState() {
        Shard created = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("name", "Acme Ltd");
        Instant syncedAt = Instant.now();

        Shard updated = repository.update(created.id(), "tenant-a", ShardPatch.synced(data, syncedAt));

        assertEquals(created.id(), updated.id());
        assertEquals("Acme Ltd", updated.structuredData().get("name").asText());
        assertEquals(SyncStatus.SYNCED, updated.syncStatus());
        assertEquals(syncedAt, updated.lastSyncedAt());
        assertEquals("Acme Ltd", repository.read(created.id(), "tenant-a").orElseThrow().structuredData().get("name").asText());
    }

    @Test
    public void updateShouldFailForAnotherTenantsShard() {
        Shard created = repository.create(shard("tenant-a", "acc-1", "account", "Acme"));

        assertThrows(ShardNotFoundException.class, () -> repository.update(created.id(), "tenant-b",
                ShardPatch.synced(JsonNodeFactory.instance.objectNode(), Instant.now())));
        assertThrows(ShardNotFoundException.class, () -> repository.update("missing", "tenant-a",
                ShardPatch.synced(JsonNodeFactory.instance.objectNode(), Instant.now())));
    }

    @Test
    public void listShouldOnlyReturnTheTenantsShards() {
        repository.create(shard("tenant-a", "acc-1", "account", "Acme"));
        repository.create(shard("tenant-a", "acc-2", "account", "Globex"));
        repository.create(shard("tenant-b", "acc-1", "account", "Initech"));

        assertEquals(2, repository.list("tenant-a").size());
        assertEquals(1, repository.list("tenant-b").size());
    }
}
