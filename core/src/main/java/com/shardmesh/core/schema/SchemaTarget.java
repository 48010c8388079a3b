package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SchemaTarget(@JsonProperty("shardTypeId") String shardTypeId) {}
