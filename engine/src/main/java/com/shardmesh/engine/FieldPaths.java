package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Dotted-path access into record trees. Segments are object keys only; there is no array indexing.
 */
public final class FieldPaths {

    private FieldPaths() {
    }

    /**
     * Reads {@code path} from {@code root}. Resolution stops at the first null or absent ancestor and yields
     * a missing node.
     */
    public static JsonNode read(JsonNode root, String path) {
        if (root == null || path == null) {
            return MissingNode.getInstance();
        }
        JsonNode current = root;
        for (String part : path.split("\\.", -1)) {
            if (current == null || current.isMissingNode() || current.isNull()) {
                return MissingNode.getInstance();
            }
            if (!current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(part);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate objects and replacing any non-object
     * that is in the way.
     */
    public static void write(ObjectNode root, String path, JsonNode value) {
        String[] parts = path.split("\\.", -1);
        ObjectNode current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = current.get(parts[i]);
            if (next == null || !next.isObject()) {
                current = current.putObject(parts[i]);
            } else {
                current = (ObjectNode) next;
            }
        }
        current.set(parts[parts.length - 1], value);
    }
}
