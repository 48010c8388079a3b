package com.shardmesh.materializer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * @param workerThreads   records processed in parallel; 1 processes the batch sequentially
 * @param storageTimeout  upper bound on any single storage call
 * @param actor           recorded as {@code createdBy} on shards and edges
 */
public record MaterializerConfig(
        @JsonProperty("workerThreads") int workerThreads,
        @JsonProperty("storageTimeout") Duration storageTimeout,
        @JsonProperty("actor") String actor
) {
    public MaterializerConfig {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        if (storageTimeout == null || storageTimeout.isNegative() || storageTimeout.isZero()) {
            throw new IllegalArgumentException("storageTimeout must be positive");
        }
    }

    public static MaterializerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerThreads = 1;
        private Duration storageTimeout = Duration.ofSeconds(10);
        private String actor = "system";

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder storageTimeout(Duration storageTimeout) {
            this.storageTimeout = storageTimeout;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public MaterializerConfig build() {
            return new MaterializerConfig(workerThreads, storageTimeout, actor);
        }
    }
}
