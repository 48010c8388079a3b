package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractedField(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target
) {}
