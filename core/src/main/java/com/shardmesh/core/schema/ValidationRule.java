package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record ValidationRule(
        @JsonProperty("type") ValidationType type,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("message") String message
) {}
