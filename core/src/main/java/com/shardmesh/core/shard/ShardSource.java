package com.shardmesh.core.shard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShardSource {
    UI("ui"),
    API("api"),
    IMPORT("import"),
    INTEGRATION("integration"),
    SYSTEM("system");

    private final String wireName;

    ShardSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
