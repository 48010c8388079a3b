package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.core.Json;

import java.util.Map;

/**
 * Per-call inputs the engine may read besides the record itself. {@code taskConfig} feeds
 * {@code {{task.KEY}}} placeholders in default values.
 */
public record TransformationContext(
        String tenantId,
        String integrationId,
        JsonNode sourceData,
        Map<String, String> taskConfig
) {
    public TransformationContext {
        taskConfig = taskConfig == null ? Map.of() : Map.copyOf(taskConfig);
    }

    public static TransformationContext of(String tenantId, String integrationId) {
        return new TransformationContext(tenantId, integrationId, null, Map.of());
    }

    public TransformationContext withSourceData(JsonNode sourceData) {
        return new TransformationContext(tenantId, integrationId, sourceData, taskConfig);
    }

    /**
     * The variables a custom expression can see, with {@code value} bound to the value being transformed.
     */
    ObjectNode expressionScope(JsonNode value) {
        ObjectNode scope = Json.object();
        scope.set("value", value);
        if (tenantId != null) {
            scope.put("tenantId", tenantId);
        }
        if (integrationId != null) {
            scope.put("integrationId", integrationId);
        }
        if (sourceData != null) {
            scope.set("sourceData", sourceData);
        }
        ObjectNode task = scope.putObject("taskConfig");
        taskConfig.forEach(task::put);
        return scope;
    }
}
