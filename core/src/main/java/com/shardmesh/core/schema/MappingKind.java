package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MappingKind {
    DIRECT("direct"),
    TRANSFORM("transform"),
    CONDITIONAL("conditional"),
    DEFAULT("default"),
    COMPOSITE("composite"),
    FLATTEN("flatten"),
    LOOKUP("lookup");

    private final String wireName;

    MappingKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
