package com.shardmesh.core;

public class ConcurrentSchemaModificationException extends RuntimeException {
    public ConcurrentSchemaModificationException(String message) {
        super(message);
    }

    public ConcurrentSchemaModificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
