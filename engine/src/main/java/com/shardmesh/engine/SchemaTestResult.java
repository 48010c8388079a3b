package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Dry run of a stored schema against a sample record. Nothing is persisted.
 */
public record SchemaTestResult(
        boolean success,
        Optional<ObjectNode> transformedData,
        List<FieldReport> fieldResults,
        List<String> errors
) {
    public SchemaTestResult {
        fieldResults = List.copyOf(fieldResults);
        errors = List.copyOf(errors);
    }

    public static SchemaTestResult notFound() {
        return new SchemaTestResult(false, Optional.empty(), List.of(), List.of("Schema not found"));
    }

    public record FieldReport(
            String targetField,
            JsonNode sourceValue,
            JsonNode transformedValue,
            boolean success,
            String error
    ) {}
}
