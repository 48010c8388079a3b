package com.shardmesh.repositories.memory;

import com.fasterxml.uuid.Generators;
import com.shardmesh.core.ConcurrentSchemaModificationException;
import com.shardmesh.core.SchemaRepository;
import com.shardmesh.core.SchemaScope;
import com.shardmesh.core.schema.ConversionSchema;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Conversion schemas held in memory, keyed by scope and id. Updates must carry the version they read.
 */
public class InMemorySchemaRepository implements SchemaRepository {
    private final Map<Key, ConversionSchema> db = new ConcurrentHashMap<>();

    private record Key(SchemaScope scope, String id) {}

    @Override
    public ConversionSchema create(ConversionSchema schema) {
        String id = schema.id() != null ? schema.id() : Generators.timeBasedGenerator().generate().toString();
        Instant now = Instant.now();
        ConversionSchema stored = schema.toBuilder()
                .id(id)
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (db.putIfAbsent(new Key(schema.scope(), id), stored) != null) {
            throw new IllegalStateException("Schema " + id + " already exists");
        }
        return stored;
    }

    @Override
    public Optional<ConversionSchema> findById(String id, SchemaScope scope) {
        return Optional.ofNullable(db.get(new Key(scope, id)));
    }

    @Override
    public Optional<ConversionSchema> update(String id, SchemaScope scope, ConversionSchema schema) {
        ConversionSchema updated = db.computeIfPresent(new Key(scope, id), (key, existing) -> {
            if (existing.version() != schema.version()) {
                throw new ConcurrentSchemaModificationException(
                        "Schema " + id + " is at version " + existing.version() + ", update was based on " + schema.version());
            }
            return schema.toBuilder()
                    .id(id)
                    .scope(scope)
                    .version(existing.version() + 1)
                    .createdAt(existing.createdAt())
                    .updatedAt(Instant.now())
                    .build();
        });
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean delete(String id, SchemaScope scope) {
        return db.remove(new Key(scope, id)) != null;
    }

    @Override
    public List<ConversionSchema> list(SchemaScope scope) {
        return db.entrySet().stream()
                .filter(e -> e.getKey().scope().equals(scope))
                .map(Map.Entry::getValue)
                .sorted(Comparator.comparing(ConversionSchema::createdAt))
                .collect(Collectors.toList());
    }
}
