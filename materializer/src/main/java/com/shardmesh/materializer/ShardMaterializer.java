package com.shardmesh.materializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.core.DuplicateShardException;
import com.shardmesh.core.Json;
import com.shardmesh.core.MaterializationConfigurationException;
import com.shardmesh.core.RelationshipRepository;
import com.shardmesh.core.ShardRepository;
import com.shardmesh.core.Telemetry;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.DerivedDescriptor;
import com.shardmesh.core.schema.RelationshipDeclaration;
import com.shardmesh.core.shard.DedupKey;
import com.shardmesh.core.shard.Shard;
import com.shardmesh.core.shard.ShardPatch;
import com.shardmesh.core.shard.ShardRelationship;
import com.shardmesh.core.shard.ShardSource;
import com.shardmesh.core.shard.SyncStatus;
import com.shardmesh.engine.FieldPaths;
import com.shardmesh.engine.TransformEngine;
import com.shardmesh.engine.TransformResult;
import com.shardmesh.engine.TransformationContext;
import com.shardmesh.materializer.MaterializationResult.Edge;
import com.shardmesh.materializer.MaterializationResult.Failure;
import com.shardmesh.materializer.MaterializationResult.ShardRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a batch of integration records into shards: one primary shard per record, the derived shards the
 * schema describes, and the edges between them.
 * <p>
 * Records are independent. A failing record lands in {@link MaterializationResult#failed()} and the batch
 * goes on; only a call that cannot run at all throws. Check-then-create for a dedup key runs under a
 * per-key lock, so parallel workers never create the same shard twice.
 */
public class ShardMaterializer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ShardMaterializer.class);
    private static final AtomicInteger WORKERS = new AtomicInteger();

    static final String UNKNOWN_EXTERNAL_ID = "unknown";

    private final ShardRepository shards;
    private final RelationshipRepository relationships;
    private final TransformEngine engine;
    private final Telemetry telemetry;
    private final MaterializerConfig config;
    private final StorageCalls storage;
    private final KeyedLocks<DedupKey> locks = new KeyedLocks<>();

    public ShardMaterializer(ShardRepository shards, RelationshipRepository relationships, TransformEngine engine,
                             Telemetry telemetry, MaterializerConfig config) {
        this.shards = shards;
        this.relationships = relationships;
        this.engine = engine;
        this.telemetry = telemetry;
        this.config = config;
        this.storage = new StorageCalls(config.storageTimeout());
    }

    private record Invocation(String tenantId, String integrationId, ConversionSchema schema, String primaryShardTypeId,
                              MaterializationOptions options) {}

    private enum Disposition { CREATED, UPDATED, UNCHANGED }

    private record Upserted(Shard shard, Disposition disposition) {}

    /**
     * Everything one record contributed, merged into the batch result in input order.
     */
    private static final class RecordOutcome {
        final List<ShardRef> created = new ArrayList<>();
        final List<ShardRef> updated = new ArrayList<>();
        final List<ShardRef> unchanged = new ArrayList<>();
        final List<Failure> failed = new ArrayList<>();
        final List<Edge> edges = new ArrayList<>();

        void add(Upserted upserted) {
            ShardRef ref = ShardRef.of(upserted.shard());
            switch (upserted.disposition()) {
                case CREATED -> created.add(ref);
                case UPDATED -> updated.add(ref);
                case UNCHANGED -> unchanged.add(ref);
            }
        }
    }

    public MaterializationResult materialize(String tenantId, String integrationId, List<JsonNode> records,
                                             ConversionSchema schema, MaterializationOptions options) {
        Invocation invocation = validate(tenantId, integrationId, schema, options == null ? MaterializationOptions.defaults() : options);
        List<JsonNode> batch = records == null ? List.of() : records;
        long started = System.currentTimeMillis();

        Map<String, Object> startedEvent = new HashMap<>();
        startedEvent.put("tenantId", tenantId);
        startedEvent.put("integrationId", integrationId);
        startedEvent.put("recordCount", batch.size());
        startedEvent.put("schemaId", schema.id());
        telemetry.trackEvent("integration.shard.create.started", startedEvent);

        List<RecordOutcome> outcomes = run(invocation, batch);

        List<ShardRef> created = new ArrayList<>();
        List<ShardRef> updated = new ArrayList<>();
        List<ShardRef> unchanged = new ArrayList<>();
        List<Failure> failed = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        for (RecordOutcome outcome : outcomes) {
            created.addAll(outcome.created);
            updated.addAll(outcome.updated);
            unchanged.addAll(outcome.unchanged);
            failed.addAll(outcome.failed);
            edges.addAll(outcome.edges);
        }
        long duration = System.currentTimeMillis() - started;

        Map<String, Object> completedEvent = new HashMap<>();
        completedEvent.put("tenantId", tenantId);
        completedEvent.put("integrationId", integrationId);
        completedEvent.put("created", created.size());
        completedEvent.put("updated", updated.size());
        completedEvent.put("unchanged", unchanged.size());
        completedEvent.put("failed", failed.size());
        completedEvent.put("relationships", edges.size());
        completedEvent.put("durationMs", duration);
        telemetry.trackEvent("integration.shard.create.completed", completedEvent);

        logger.info("Materialized {} records for tenant {} integration {}: {} created, {} updated, {} unchanged, {} failed",
                batch.size(), tenantId, integrationId, created.size(), updated.size(), unchanged.size(), failed.size());
        return new MaterializationResult(created, updated, unchanged, failed, edges, duration);
    }

    private static Invocation validate(String tenantId, String integrationId, ConversionSchema schema,
                                       MaterializationOptions options) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new MaterializationConfigurationException("tenantId is required");
        }
        if (integrationId == null || integrationId.isBlank()) {
            throw new MaterializationConfigurationException("integrationId is required");
        }
        if (schema == null) {
            throw new MaterializationConfigurationException("A conversion schema is required");
        }
        String primary = schema.primaryShardTypeId();
        if (primary == null) {
            throw new MaterializationConfigurationException("Schema " + schema.id() + " must specify a primary shard type");
        }
        return new Invocation(tenantId, integrationId, schema, primary, options);
    }

    private List<RecordOutcome> run(Invocation invocation, List<JsonNode> batch) {
        int workers = Math.min(config.workerThreads(), batch.size());
        List<RecordOutcome> outcomes = new ArrayList<>(batch.size());
        if (workers <= 1) {
            for (JsonNode record : batch) {
                outcomes.add(materializeRecord(invocation, record));
            }
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread thread = new Thread(r, "shard-materializer-" + WORKERS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<RecordOutcome>> futures = new ArrayList<>(batch.size());
            for (JsonNode record : batch) {
                futures.add(pool.submit(() -> materializeRecord(invocation, record)));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(invocation, futures.get(i), batch.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private RecordOutcome await(Invocation invocation, Future<RecordOutcome> future, JsonNode record) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while materializing a batch", e);
        } catch (ExecutionException e) {
            // materializeRecord reports its own failures; this is an Error escaping a worker
            RecordOutcome outcome = new RecordOutcome();
            String id = IdentityResolver.externalId(record, invocation.schema()).orElse(UNKNOWN_EXTERNAL_ID);
            outcome.failed.add(new Failure(id, messageOf(e.getCause())));
            return outcome;
        }
    }

    private RecordOutcome materializeRecord(Invocation invocation, JsonNode record) {
        RecordOutcome outcome = new RecordOutcome();
        Optional<String> externalId = IdentityResolver.externalId(record, invocation.schema());
        try {
            if (externalId.isEmpty()) {
                outcome.failed.add(new Failure(UNKNOWN_EXTERNAL_ID, "Record must have an external ID"));
                return outcome;
            }

            TransformationContext context = new TransformationContext(
                    invocation.tenantId(), invocation.integrationId(), record, invocation.options().taskConfig());
            TransformResult transformed = engine.transform(invocation.schema(), record, context);
            if (!transformed.success()) {
                outcome.failed.add(new Failure(externalId.get(), String.join("; ", transformed.errors())));
                return outcome;
            }

            String name = IdentityResolver.name(record, invocation.schema()).orElse(externalId.get());
            ObjectNode metadata = Json.object();
            metadata.put("integrationId", invocation.integrationId());
            metadata.put("externalId", externalId.get());
            metadata.set("originalRecord", record.deepCopy());

            DedupKey key = new DedupKey(invocation.tenantId(), invocation.integrationId(), externalId.get(),
                    invocation.primaryShardTypeId());
            Upserted primary = upsert(invocation, key, name, transformed.data().orElseGet(Json::object), metadata);
            outcome.add(primary);

            if (invocation.options().linkDerivedShards()) {
                for (DerivedDescriptor descriptor : invocation.schema().derived()) {
                    materializeDerived(invocation, record, externalId.get(), primary.shard(), descriptor, outcome);
                }
            }

            if (invocation.options().createRelationships()) {
                for (RelationshipDeclaration declaration : invocation.schema().relationships()) {
                    linkDeclared(invocation, record, primary.shard(), declaration, outcome);
                }
            }
        } catch (RuntimeException e) {
            String id = externalId.orElse(UNKNOWN_EXTERNAL_ID);
            logger.warn("Record {} failed to materialize for tenant {}: {}", id, invocation.tenantId(), e.getMessage());
            outcome.failed.add(new Failure(id, messageOf(e)));

            Map<String, Object> properties = new HashMap<>();
            properties.put("operation", "integration.shard.create.record");
            properties.put("tenantId", invocation.tenantId());
            properties.put("integrationId", invocation.integrationId());
            properties.put("recordId", id);
            telemetry.trackException(e, properties);
        }
        return outcome;
    }

    private void materializeDerived(Invocation invocation, JsonNode record, String recordExternalId, Shard primary,
                                    DerivedDescriptor descriptor, RecordOutcome outcome) {
        try {
            Optional<DerivedExtractor.Extracted> extracted = DerivedExtractor.extract(record, descriptor);
            if (extracted.isEmpty()) {
                logger.debug("No data for derived shard type {} in record {}", descriptor.shardTypeId(), recordExternalId);
                return;
            }

            String externalId = extracted.get().externalId().orElse(primary.id() + "-" + descriptor.shardTypeId());
            String name = extracted.get().name().orElse(externalId);
            ObjectNode metadata = Json.object();
            metadata.put("integrationId", invocation.integrationId());
            metadata.put("externalId", externalId);
            metadata.put("primaryShardId", primary.id());

            DedupKey key = new DedupKey(invocation.tenantId(), invocation.integrationId(), externalId, descriptor.shardTypeId());
            Upserted derived = upsert(invocation, key, name, extracted.get().data(), metadata);
            outcome.add(derived);

            if (descriptor.linkToPrimary() && descriptor.linkRelationshipType() != null
                    && !descriptor.linkRelationshipType().isBlank()) {
                link(invocation, primary, derived.shard(), descriptor.linkRelationshipType(), outcome);
            }
        } catch (RuntimeException e) {
            logger.warn("Derived shard {} failed for record {}: {}", descriptor.shardTypeId(), recordExternalId, e.getMessage());
            outcome.failed.add(new Failure(recordExternalId, "Derived shard creation failed: " + messageOf(e)));

            Map<String, Object> properties = new HashMap<>();
            properties.put("operation", "integration.shard.create.derived");
            properties.put("tenantId", invocation.tenantId());
            properties.put("integrationId", invocation.integrationId());
            properties.put("derivedTypeId", descriptor.shardTypeId());
            telemetry.trackException(e, properties);
        }
    }

    private void linkDeclared(Invocation invocation, JsonNode record, Shard primary, RelationshipDeclaration declaration,
                              RecordOutcome outcome) {
        Optional<String> targetExternalId = IdentityResolver.asIdentifier(
                FieldPaths.read(record, declaration.targetExternalIdField()));
        if (targetExternalId.isEmpty()) {
            return;
        }
        Optional<Shard> target;
        try {
            target = storage.call("findByExternalId", () -> shards.findByExternalId(
                    invocation.tenantId(), invocation.integrationId(), targetExternalId.get(), declaration.targetShardTypeId()));
        } catch (RuntimeException e) {
            trackLinkFailure(invocation, primary, declaration.relationshipType(), e);
            return;
        }
        if (target.isEmpty()) {
            logger.debug("No {} shard with external id {}, skipping {} edge", declaration.targetShardTypeId(),
                    targetExternalId.get(), declaration.relationshipType());
            return;
        }
        link(invocation, primary, target.get(), declaration.relationshipType(), outcome);
    }

    /**
     * Best effort: a failed edge is logged and reported to telemetry, never to the record's outcome.
     */
    private void link(Invocation invocation, Shard source, Shard target, String type, RecordOutcome outcome) {
        ObjectNode metadata = Json.object();
        metadata.put("integrationId", invocation.integrationId());
        ShardRelationship edge = ShardRelationship.link(invocation.tenantId(), source, target, type, config.actor(), metadata);
        try {
            storage.call("createRelationship", () -> relationships.createRelationship(edge));
            outcome.edges.add(new Edge(source.id(), target.id(), type));
        } catch (RuntimeException e) {
            trackLinkFailure(invocation, source, type, e);
        }
    }

    private void trackLinkFailure(Invocation invocation, Shard source, String type, RuntimeException e) {
        logger.warn("Could not link {} edge from shard {}: {}", type, source.id(), e.getMessage());
        Map<String, Object> properties = new HashMap<>();
        properties.put("operation", "integration.shard.create.relationship");
        properties.put("tenantId", invocation.tenantId());
        properties.put("sourceShardId", source.id());
        properties.put("relationshipType", type);
        telemetry.trackException(e, properties);
    }

    private Upserted upsert(Invocation invocation, DedupKey key, String name, ObjectNode data, ObjectNode metadata) {
        return locks.withLock(key, () -> {
            if (!invocation.options().skipDuplicateCheck()) {
                Optional<Shard> existing = storage.call("findByExternalId", () -> shards.findByExternalId(
                        key.tenantId(), key.integrationId(), key.externalId(), key.shardTypeId()));
                if (existing.isPresent()) {
                    return existing(invocation, existing.get(), data);
                }
            }

            Shard shard = new Shard(null, key.tenantId(), key.shardTypeId(), name, key.integrationId(), key.externalId(),
                    data, ShardSource.INTEGRATION, SyncStatus.SYNCED, Instant.now(), metadata, config.actor(), null, null);
            try {
                return new Upserted(storage.call("create", () -> shards.create(shard)), Disposition.CREATED);
            } catch (DuplicateShardException e) {
                logger.debug("Shard for {} appeared concurrently, treating it as existing", key);
                Shard winner = storage.call("findByExternalId", () -> shards.findByExternalId(
                        key.tenantId(), key.integrationId(), key.externalId(), key.shardTypeId()))
                        .orElseThrow(() -> e);
                return existing(invocation, winner, data);
            }
        });
    }

    private Upserted existing(Invocation invocation, Shard existing, ObjectNode data) {
        if (!invocation.options().updateExisting()) {
            return new Upserted(existing, Disposition.UNCHANGED);
        }
        Shard updated = storage.call("update", () ->
                shards.update(existing.id(), existing.tenantId(), ShardPatch.synced(data, Instant.now())));
        return new Upserted(updated, Disposition.UPDATED);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    @Override
    public void close() {
        storage.close();
    }
}
