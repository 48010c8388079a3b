package com.shardmesh.repositories.memory;

/**
 * The three storage collaborators backed by memory, created together.
 */
public class InMemoryStorage {
    private final InMemorySchemaRepository schemas = new InMemorySchemaRepository();
    private final InMemoryShardRepository shards = new InMemoryShardRepository();
    private final InMemoryRelationshipRepository relationships = new InMemoryRelationshipRepository();

    public InMemorySchemaRepository schemas() {
        return schemas;
    }

    public InMemoryShardRepository shards() {
        return shards;
    }

    public InMemoryRelationshipRepository relationships() {
        return relationships;
    }
}
