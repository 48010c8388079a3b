package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConditionalRule(
        @JsonProperty("condition") Condition condition,
        @JsonProperty("then") Outcome then
) {}
