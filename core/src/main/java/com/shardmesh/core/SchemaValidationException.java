package com.shardmesh.core;

import java.util.List;

/**
 * A conversion schema was rejected before it was written.
 */
public class SchemaValidationException extends RuntimeException {
    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> violations() {
        return violations;
    }
}
