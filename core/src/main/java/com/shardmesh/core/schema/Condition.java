package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record Condition(
        @JsonProperty("field") String field,
        @JsonProperty("operator") ConditionOperator operator,
        @JsonProperty("value") JsonNode value
) {}
