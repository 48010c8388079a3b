package com.shardmesh.core;

public class ShardNotFoundException extends RuntimeException {
    public ShardNotFoundException(String message) {
        super(message);
    }

    public ShardNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
