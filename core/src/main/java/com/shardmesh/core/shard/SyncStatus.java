package com.shardmesh.core.shard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
    SYNCED("synced"),
    PENDING("pending"),
    FAILED("failed");

    private final String wireName;

    SyncStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
