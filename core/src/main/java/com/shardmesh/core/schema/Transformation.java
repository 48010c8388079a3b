package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.Json;

import java.util.Objects;

/**
 * One operator in a transformation chain. {@code config} holds the operator-specific settings,
 * e.g. {@code {"divisor": 100}} for {@code divide}.
 */
public record Transformation(
        @JsonProperty("type") TransformationType type,
        @JsonProperty("config") JsonNode config
) {
    public Transformation {
        Objects.requireNonNull(type, "type");
        if (config == null || config.isNull() || config.isMissingNode()) {
            config = Json.object();
        }
    }

    public static Transformation of(TransformationType type) {
        return new Transformation(type, null);
    }

    public static Transformation of(TransformationType type, JsonNode config) {
        return new Transformation(type, config);
    }
}
