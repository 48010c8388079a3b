package com.shardmesh.core;

/**
 * Thrown before any record is processed when a batch call cannot run at all.
 */
public class MaterializationConfigurationException extends RuntimeException {
    public MaterializationConfigurationException(String message) {
        super(message);
    }

    public MaterializationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
