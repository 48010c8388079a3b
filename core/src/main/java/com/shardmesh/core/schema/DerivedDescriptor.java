package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A secondary shard cut out of the same source record as the primary one.
 */
public record DerivedDescriptor(
        @JsonProperty("shardTypeId") String shardTypeId,
        @JsonProperty("dataExtraction") DataExtraction dataExtraction,
        @JsonProperty("linkToPrimary") boolean linkToPrimary,
        @JsonProperty("linkRelationshipType") String linkRelationshipType
) {}
