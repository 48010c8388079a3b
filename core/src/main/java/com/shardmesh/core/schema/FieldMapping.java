package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Produces one target field. {@code targetField} is a dotted path into the output document.
 */
public record FieldMapping(
        @JsonProperty("targetField") String targetField,
        @JsonProperty("config") MappingConfig config,
        @JsonProperty("validation") List<ValidationRule> validation,
        @JsonProperty("required") boolean required
) {
    public FieldMapping {
        validation = validation == null ? List.of() : List.copyOf(validation);
    }

    public static FieldMapping optional(String targetField, MappingConfig config) {
        return new FieldMapping(targetField, config, null, false);
    }

    public static FieldMapping required(String targetField, MappingConfig config) {
        return new FieldMapping(targetField, config, null, true);
    }
}
