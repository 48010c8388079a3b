package com.shardmesh.materializer;

import java.util.Map;

/**
 * Per-call switches. {@code taskConfig} feeds {@code {{task.KEY}}} placeholders in the schema's defaults.
 */
public record MaterializationOptions(
        boolean skipDuplicateCheck,
        boolean updateExisting,
        boolean createRelationships,
        boolean linkDerivedShards,
        Map<String, String> taskConfig
) {
    public MaterializationOptions {
        taskConfig = taskConfig == null ? Map.of() : Map.copyOf(taskConfig);
    }

    public static MaterializationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean skipDuplicateCheck;
        private boolean updateExisting;
        private boolean createRelationships = true;
        private boolean linkDerivedShards = true;
        private Map<String, String> taskConfig = Map.of();

        public Builder skipDuplicateCheck(boolean skipDuplicateCheck) {
            this.skipDuplicateCheck = skipDuplicateCheck;
            return this;
        }

        public Builder updateExisting(boolean updateExisting) {
            this.updateExisting = updateExisting;
            return this;
        }

        public Builder createRelationships(boolean createRelationships) {
            this.createRelationships = createRelationships;
            return this;
        }

        public Builder linkDerivedShards(boolean linkDerivedShards) {
            this.linkDerivedShards = linkDerivedShards;
            return this;
        }

        public Builder taskConfig(Map<String, String> taskConfig) {
            this.taskConfig = taskConfig;
            return this;
        }

        public MaterializationOptions build() {
            return new MaterializationOptions(skipDuplicateCheck, updateExisting, createRelationships, linkDerivedShards, taskConfig);
        }
    }
}
