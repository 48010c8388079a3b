package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * How a target field gets its value. The {@code type} property of the stored document selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MappingConfig.Direct.class, name = "direct"),
        @JsonSubTypes.Type(value = MappingConfig.Transform.class, name = "transform"),
        @JsonSubTypes.Type(value = MappingConfig.Conditional.class, name = "conditional"),
        @JsonSubTypes.Type(value = MappingConfig.Default.class, name = "default"),
        @JsonSubTypes.Type(value = MappingConfig.Composite.class, name = "composite"),
        @JsonSubTypes.Type(value = MappingConfig.Flatten.class, name = "flatten"),
        @JsonSubTypes.Type(value = MappingConfig.Lookup.class, name = "lookup")
})
public sealed interface MappingConfig {

    MappingKind kind();

    record Direct(
            @JsonProperty("sourceField") String sourceField
    ) implements MappingConfig {
        @Override
        public MappingKind kind() {
            return MappingKind.DIRECT;
        }
    }

    record Transform(
            @JsonProperty("sourceField") String sourceField,
            @JsonProperty("transformations") List<Transformation> transformations
    ) implements MappingConfig {
        public Transform {
            transformations = transformations == null ? List.of() : List.copyOf(transformations);
        }

        @Override
        public MappingKind kind() {
            return MappingKind.TRANSFORM;
        }
    }

    record Conditional(
            @JsonProperty("conditions") List<ConditionalRule> conditions,
            @JsonProperty("default") JsonNode defaultValue
    ) implements MappingConfig {
        public Conditional {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        @Override
        public MappingKind kind() {
            return MappingKind.CONDITIONAL;
        }
    }

    record Default(
            @JsonProperty("value") JsonNode value
    ) implements MappingConfig {
        @Override
        public MappingKind kind() {
            return MappingKind.DEFAULT;
        }
    }

    record Composite(
            @JsonProperty("sourceFields") List<String> sourceFields,
            @JsonProperty("separator") String separator,
            @JsonProperty("template") String template
    ) implements MappingConfig {
        public Composite {
            sourceFields = sourceFields == null ? List.of() : List.copyOf(sourceFields);
        }

        @Override
        public MappingKind kind() {
            return MappingKind.COMPOSITE;
        }
    }

    record Flatten(
            @JsonProperty("sourceField") String sourceField,
            @JsonProperty("path") String path
    ) implements MappingConfig {
        @Override
        public MappingKind kind() {
            return MappingKind.FLATTEN;
        }
    }

    record Lookup(
            @JsonProperty("sourceField") String sourceField,
            @JsonProperty("dictionary") String dictionary
    ) implements MappingConfig {
        @Override
        public MappingKind kind() {
            return MappingKind.LOOKUP;
        }
    }
}
