package com.shardmesh.repos.certification;

import com.shardmesh.core.ConcurrentSchemaModificationException;
import com.shardmesh.core.SchemaRepository;
import com.shardmesh.core.SchemaScope;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public abstract class SchemaRepositoryCertification {
    protected SchemaRepository repository;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    private static ConversionSchema schema(SchemaScope scope, String name) {
        return ConversionSchema.builder()
                .scope(scope)
                .name(name)
                .sourceEntity("Account")
                .targetShardType("account")
                .fieldMapping(FieldMapping.required("name", new MappingConfig.Direct("Name")))
                .build();
    }

    @Test
    public void createShouldAssignIdAndFirstVersion() {
        ConversionSchema created = repository.create(schema(SchemaScope.tenant("tenant-a"), "Accounts"));

        assertNotNull(created.id());
        assertEquals(1, created.version());
        assertNotNull(created.createdAt());
        assertEquals(created.createdAt(), created.updatedAt());
    }

    @Test
    public void findByIdShouldNotCrossScopes() {
        ConversionSchema created = repository.create(schema(SchemaScope.tenant("tenant-a"), "Accounts"));

        assertTrue(repository.findById(created.id(), SchemaScope.tenant("tenant-a")).isPresent());
        assertTrue(repository.findById(created.id(), SchemaScope.tenant("tenant-b")).isEmpty());
        assertTrue(repository.findById(created.id(), SchemaScope.global()).isEmpty());
    }

    @Test
    public void globalSchemasShouldOnlyBeVisibleInGlobalScope() {
        ConversionSchema created = repository.create(schema(SchemaScope.global(), "Shared accounts"));

        assertTrue(repository.findById(created.id(), SchemaScope.global()).isPresent());
        assertTrue(repository.findById(created.id(), SchemaScope.tenant("tenant-a")).isEmpty());
    }

    @Test
    public void updateShouldBumpTheVersion() {
        SchemaScope scope = SchemaScope.tenant("tenant-a");
        ConversionSchema created = repository.create(schema(scope, "Accounts"));

        Optional<ConversionSchema> updated = repository.update(created.id(), scope,
                created.toBuilder().name("Accounts v2").build());

        assertTrue(updated.isPresent());
        assertEquals(2, updated.get().version());
        assertEquals("Accounts v2", updated.get().name());
        assertEquals(created.createdAt(), updated.get().createdAt());
    }

    @Test
    public void updateFromAStaleVersionShouldBeRejected() {
        SchemaScope scope = SchemaScope.tenant("tenant-a");
        ConversionSchema created = repository.create(schema(scope, "Accounts"));
        repository.update(created.id(), scope, created.toBuilder().name("First edit").build());

        assertThrows(ConcurrentSchemaModificationException.class,
                () -> repository.update(created.id(), scope, created.toBuilder().name("Second edit").build()));
        assertEquals("First edit", repository.findById(created.id(), scope).orElseThrow().name());
    }

    @Test
    public void updateOfAMissingSchemaShouldReturnEmpty() {
        SchemaScope scope = SchemaScope.tenant("tenant-a");

        assertTrue(repository.update("missing", scope, schema(scope, "Nothing")).isEmpty());
    }

    @Test
    public void deleteShouldRemoveOnlyWithinScope() {
        ConversionSchema created = repository.create(schema(SchemaScope.tenant("tenant-a"), "Accounts"));

        assertFalse(repository.delete(created.id(), SchemaScope.tenant("tenant-b")));
        assertTrue(repository.delete(created.id(), SchemaScope.tenant("tenant-a")));
        assertTrue(repository.findById(created.id(), SchemaScope.tenant("tenant-a")).isEmpty());
    }

    @Test
    public void listShouldReturnTheScopesSchemas() {
        repository.create(schema(SchemaScope.tenant("tenant-a"), "Accounts"));
        repository.create(schema(SchemaScope.tenant("tenant-a"), "Contacts"));
        repository.create(schema(SchemaScope.global(), "Shared"));

        assertEquals(2, repository.list(SchemaScope.tenant("tenant-a")).size());
        assertEquals(1, repository.list(SchemaScope.global()).size());
    }
}
