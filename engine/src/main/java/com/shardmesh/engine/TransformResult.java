package com.shardmesh.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code data} is present only when no required mapping failed.
 */
public record TransformResult(boolean success, Optional<ObjectNode> data, List<String> errors) {

    public static TransformResult succeeded(ObjectNode data) {
        return new TransformResult(true, Optional.of(data), List.of());
    }

    public static TransformResult failed(List<String> errors) {
        return new TransformResult(false, Optional.empty(), List.copyOf(errors));
    }
}
