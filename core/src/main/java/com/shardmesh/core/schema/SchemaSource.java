package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SchemaSource(@JsonProperty("entity") String entity) {}
