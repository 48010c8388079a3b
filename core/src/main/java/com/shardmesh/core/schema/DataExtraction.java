package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DataExtraction(
        @JsonProperty("fields") List<ExtractedField> fields,
        @JsonProperty("externalIdField") String externalIdField,
        @JsonProperty("nameField") String nameField
) {
    public DataExtraction {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
