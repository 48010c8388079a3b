package com.shardmesh.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneId;
import java.time.ZoneOffset;

public record EngineConfig(
        @JsonProperty("zone") ZoneId zone,
        @JsonProperty("maxExpressionLength") int maxExpressionLength,
        @JsonProperty("truncateCap") int truncateCap,
        @JsonProperty("defaultTruncateLength") int defaultTruncateLength
) {
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ZoneId zone = ZoneOffset.UTC;
        private int maxExpressionLength = 1000;
        private int truncateCap = 10_000;
        private int defaultTruncateLength = 100;

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder maxExpressionLength(int maxExpressionLength) {
            this.maxExpressionLength = maxExpressionLength;
            return this;
        }

        public Builder truncateCap(int truncateCap) {
            this.truncateCap = truncateCap;
            return this;
        }

        public Builder defaultTruncateLength(int defaultTruncateLength) {
            this.defaultTruncateLength = defaultTruncateLength;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(zone, maxExpressionLength, truncateCap, defaultTruncateLength);
        }
    }
}
