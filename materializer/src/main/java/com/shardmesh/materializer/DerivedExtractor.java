package com.shardmesh.materializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.schema.DataExtraction;
import com.shardmesh.core.schema.DerivedDescriptor;
import com.shardmesh.core.schema.ExtractedField;
import com.shardmesh.engine.FieldPaths;
import com.shardmesh.engine.JsValues;

import java.util.Optional;

/**
 * Cuts the data of a derived shard out of a source record.
 */
final class DerivedExtractor {

    record Extracted(ObjectNode data, Optional<String> externalId, Optional<String> name) {}

    private DerivedExtractor() {
    }

    /**
     * @return empty when the descriptor extracts no fields from this record
     */
    static Optional<Extracted> extract(JsonNode record, DerivedDescriptor descriptor) {
        DataExtraction extraction = descriptor.dataExtraction();
        if (extraction == null) {
            return Optional.empty();
        }

        ObjectNode data = Json.object();
        for (ExtractedField field : extraction.fields()) {
            if (field.source() == null || field.target() == null) {
                continue;
            }
            JsonNode value = FieldPaths.read(record, field.source());
            if (!JsValues.isNullish(value)) {
                FieldPaths.write(data, field.target(), value.deepCopy());
            }
        }
        if (data.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new Extracted(
                data,
                declared(record, extraction.externalIdField()),
                declared(record, extraction.nameField())));
    }

    private static Optional<String> declared(JsonNode record, String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        return IdentityResolver.asIdentifier(FieldPaths.read(record, field));
    }
}
