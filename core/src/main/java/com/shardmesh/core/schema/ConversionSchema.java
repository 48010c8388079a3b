package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardmesh.core.SchemaScope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative mapping from one external record shape to a primary shard type and any derived shard types.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversionSchema(
        @JsonProperty("id") String id,
        @JsonProperty("scope") SchemaScope scope,
        @JsonProperty("name") String name,
        @JsonProperty("source") SchemaSource source,
        @JsonProperty("target") SchemaTarget target,
        @JsonProperty("fieldMappings") List<FieldMapping> fieldMappings,
        @JsonProperty("relationships") List<RelationshipDeclaration> relationships,
        @JsonProperty("outputShardTypes") OutputShardTypes outputShardTypes,
        @JsonProperty("externalIdField") String externalIdField,
        @JsonProperty("nameField") String nameField,
        @JsonProperty("version") long version,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt
) {
    public ConversionSchema {
        fieldMappings = fieldMappings == null ? List.of() : List.copyOf(fieldMappings);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    /**
     * The shard type every record of this schema materializes into, or null when the schema names none.
     */
    @JsonIgnore
    public String primaryShardTypeId() {
        if (outputShardTypes != null && outputShardTypes.primary() != null && !outputShardTypes.primary().isBlank()) {
            return outputShardTypes.primary();
        }
        if (target != null && target.shardTypeId() != null && !target.shardTypeId().isBlank()) {
            return target.shardTypeId();
        }
        return null;
    }

    @JsonIgnore
    public List<DerivedDescriptor> derived() {
        return outputShardTypes == null ? List.of() : outputShardTypes.derived();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scope(scope)
                .name(name)
                .source(source)
                .target(target)
                .fieldMappings(fieldMappings)
                .relationships(relationships)
                .outputShardTypes(outputShardTypes)
                .externalIdField(externalIdField)
                .nameField(nameField)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private SchemaScope scope;
        private String name;
        private SchemaSource source;
        private SchemaTarget target;
        private List<FieldMapping> fieldMappings = new ArrayList<>();
        private List<RelationshipDeclaration> relationships = new ArrayList<>();
        private OutputShardTypes outputShardTypes;
        private String externalIdField;
        private String nameField;
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scope(SchemaScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder source(SchemaSource source) {
            this.source = source;
            return this;
        }

        public Builder sourceEntity(String entity) {
            this.source = new SchemaSource(entity);
            return this;
        }

        public Builder target(SchemaTarget target) {
            this.target = target;
            return this;
        }

        public Builder targetShardType(String shardTypeId) {
            this.target = new SchemaTarget(shardTypeId);
            return this;
        }

        public Builder fieldMappings(List<FieldMapping> fieldMappings) {
            this.fieldMappings = new ArrayList<>(fieldMappings);
            return this;
        }

        public Builder fieldMapping(FieldMapping fieldMapping) {
            this.fieldMappings.add(fieldMapping);
            return this;
        }

        public Builder relationships(List<RelationshipDeclaration> relationships) {
            this.relationships = new ArrayList<>(relationships);
            return this;
        }

        public Builder relationship(RelationshipDeclaration relationship) {
            this.relationships.add(relationship);
            return this;
        }

        public Builder outputShardTypes(OutputShardTypes outputShardTypes) {
            this.outputShardTypes = outputShardTypes;
            return this;
        }

        public Builder externalIdField(String externalIdField) {
            this.externalIdField = externalIdField;
            return this;
        }

        public Builder nameField(String nameField) {
            this.nameField = nameField;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ConversionSchema build() {
            return new ConversionSchema(
                    id,
                    scope,
                    name,
                    source,
                    target,
                    fieldMappings,
                    relationships,
                    outputShardTypes,
                    externalIdField,
                    nameField,
                    version,
                    createdAt,
                    updatedAt
            );
        }
    }
}
