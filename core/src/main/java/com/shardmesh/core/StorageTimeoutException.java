package com.shardmesh.core;

public class StorageTimeoutException extends RuntimeException {
    public StorageTimeoutException(String message) {
        super(message);
    }

    public StorageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
