package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of resolving one field mapping. A successful result may still carry an undefined value.
 */
public record FieldResult(boolean success, JsonNode value, String error) {

    public static FieldResult of(JsonNode value) {
        return new FieldResult(true, value, null);
    }

    public static FieldResult failure(String error) {
        return new FieldResult(false, JsValues.undefined(), error);
    }

    public boolean hasValue() {
        return success && !JsValues.isUndefined(value);
    }
}
