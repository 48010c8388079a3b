package com.shardmesh.core;

import java.util.Map;

public interface Telemetry {
    void trackEvent(String name, Map<String, Object> properties);
    void trackException(Throwable error, Map<String, Object> properties);
}
