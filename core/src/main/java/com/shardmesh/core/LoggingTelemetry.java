package com.shardmesh.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Telemetry sink that writes events and exceptions to the application log.
 */
public class LoggingTelemetry implements Telemetry {
    private static final Logger logger = LoggerFactory.getLogger(LoggingTelemetry.class);

    @Override
    public void trackEvent(String name, Map<String, Object> properties) {
        logger.info("event {} {}", name, properties);
    }

    @Override
    public void trackException(Throwable error, Map<String, Object> properties) {
        logger.warn("exception {} {}: {}", properties.get("operation"), properties, error.getMessage(), error);
    }
}
