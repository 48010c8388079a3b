package com.shardmesh.materializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.engine.FieldPaths;
import com.shardmesh.engine.JsValues;

import java.util.List;
import java.util.Optional;

/**
 * Finds the external id and display name of a source record, from the schema's declared fields or the
 * usual key names integrations send.
 */
final class IdentityResolver {
    static final List<String> EXTERNAL_ID_KEYS = List.of("id", "externalId", "Id", "external_id");
    static final List<String> NAME_KEYS = List.of("name", "Name", "title", "Title");

    private IdentityResolver() {
    }

    static Optional<String> externalId(JsonNode record, ConversionSchema schema) {
        return resolve(record, schema.externalIdField(), EXTERNAL_ID_KEYS);
    }

    static Optional<String> name(JsonNode record, ConversionSchema schema) {
        return resolve(record, schema.nameField(), NAME_KEYS);
    }

    private static Optional<String> resolve(JsonNode record, String declaredField, List<String> fallbacks) {
        if (declaredField != null && !declaredField.isBlank()) {
            return asIdentifier(FieldPaths.read(record, declaredField));
        }
        for (String key : fallbacks) {
            Optional<String> value = asIdentifier(record.path(key));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Text and number values count; blank text, booleans, containers and nulls do not.
     */
    static Optional<String> asIdentifier(JsonNode value) {
        if (JsValues.isNullish(value) || value.isContainerNode() || value.isBoolean()) {
            return Optional.empty();
        }
        String text = JsValues.toJsString(value);
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
