package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An edge from the primary shard to a shard of {@code targetShardTypeId} whose external id is read
 * from {@code targetExternalIdField} of the source record.
 */
public record RelationshipDeclaration(
        @JsonProperty("targetExternalIdField") String targetExternalIdField,
        @JsonProperty("targetShardTypeId") String targetShardTypeId,
        @JsonProperty("relationshipType") String relationshipType
) {}
