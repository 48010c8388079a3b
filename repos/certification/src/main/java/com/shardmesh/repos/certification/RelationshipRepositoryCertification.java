package com.shardmesh.repos.certification;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.shardmesh.core.RelationshipRepository;
import com.shardmesh.core.shard.ShardRelationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public abstract class RelationshipRepositoryCertification {
    protected RelationshipRepository repository;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    private static ShardRelationship edge(String tenantId, String source, String target, String type, String note) {
        return new ShardRelationship(null, tenantId, source, target, type, "account", "contact", "system",
                JsonNodeFactory.instance.objectNode().put("note", note), null);
    }

    @Test
    public void createRelationshipShouldAssignAnId() {
        ShardRelationship created = repository.createRelationship(edge("tenant-a", "s1", "t1", "has_contact", "first"));

        assertNotNull(created.id());
        assertNotNull(created.createdAt());
        assertEquals("s1", created.sourceShardId());
    }

    @Test
    public void relinkingAnEdgeShouldReplaceItsMetadataInsteadOfAddingOne() {
        ShardRelationship first = repository.createRelationship(edge("tenant-a", "s1", "t1", "has_contact", "first"));
        ShardRelationship second = repository.createRelationship(edge("tenant-a", "s1", "t1", "has_contact", "second"));

        List<ShardRelationship> edges = repository.findBySource("tenant-a", "s1");
        assertEquals(1, edges.size());
        assertEquals(first.id(), second.id());
        assertEquals("second", edges.get(0).metadata().get("note").asText());
    }

    @Test
    public void edgesWithDifferentTypesOrTargetsShouldCoexist() {
        repository.createRelationship(edge("tenant-a", "s1", "t1", "has_contact", "a"));
        repository.createRelationship(edge("tenant-a", "s1", "t1", "owned_by", "b"));
        repository.createRelationship(edge("tenant-a", "s1", "t2", "has_contact", "c"));

        assertEquals(3, repository.findBySource("tenant-a", "s1").size());
    }

    @Test
    public void listShouldBeTenantScoped() {
        repository.createRelationship(edge("tenant-a", "s1", "t1", "has_contact", "a"));
        repository.createRelationship(edge("tenant-b", "s1", "t1", "has_contact", "b"));

        assertEquals(1, repository.list("tenant-a").size());
        assertEquals(1, repository.list("tenant-b").size());
        assertTrue(repository.findBySource("tenant-c", "s1").isEmpty());
    }
}
