package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.shardmesh.core.Json;
import com.shardmesh.core.SchemaValidationException;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.DerivedDescriptor;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import com.shardmesh.core.schema.RelationshipDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Authoring checks run before a conversion schema is written: document structure against the bundled
 * JSON Schema, then the rules the structure cannot express.
 */
public class SchemaValidator {
    private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);
    private static final String SCHEMA_RESOURCE = "/schemas/conversion-schema.json";

    private final JsonSchema documentSchema;

    public SchemaValidator() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        this.documentSchema = factory.getSchema(loadDocumentSchema());
    }

    private static JsonNode loadDocumentSchema() {
        try (InputStream in = SchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return Json.MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * @throws SchemaValidationException listing every violation found
     */
    public void check(ConversionSchema schema) {
        List<String> violations = violations(schema);
        if (!violations.isEmpty()) {
            logger.debug("Rejected conversion schema {}: {}", schema.name(), violations);
            throw new SchemaValidationException(violations);
        }
    }

    public List<String> violations(ConversionSchema schema) {
        List<String> violations = new ArrayList<>();

        JsonNode document = Json.MAPPER.valueToTree(schema);
        Set<ValidationMessage> messages = documentSchema.validate(document);
        messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.toCollection(() -> violations));

        if (schema.scope() == null) {
            violations.add("Schema scope is required");
        }
        if (schema.primaryShardTypeId() == null) {
            violations.add("A primary output shard type is required");
        }

        Set<String> targetFields = new HashSet<>();
        for (FieldMapping mapping : schema.fieldMappings()) {
            if (isBlank(mapping.targetField())) {
                violations.add("Field mapping requires targetField");
                continue;
            }
            if (!targetFields.add(mapping.targetField())) {
                violations.add("Duplicate target field: " + mapping.targetField());
            }
            checkConfig(mapping, violations);
        }

        for (DerivedDescriptor derived : schema.derived()) {
            if (isBlank(derived.shardTypeId())) {
                violations.add("Derived shard type requires shardTypeId");
            } else if (derived.linkToPrimary() && isBlank(derived.linkRelationshipType())) {
                violations.add("Derived shard type " + derived.shardTypeId() + " links to primary without linkRelationshipType");
            }
        }

        for (RelationshipDeclaration relationship : schema.relationships()) {
            if (isBlank(relationship.targetExternalIdField()) || isBlank(relationship.targetShardTypeId())
                    || isBlank(relationship.relationshipType())) {
                violations.add("Relationship requires targetExternalIdField, targetShardTypeId and relationshipType");
            }
        }

        return violations;
    }

    private static void checkConfig(FieldMapping mapping, List<String> violations) {
        MappingConfig config = mapping.config();
        String field = mapping.targetField();
        if (config == null) {
            violations.add("Field mapping for " + field + " requires config");
            return;
        }

        switch (config.kind()) {
            case DIRECT -> {
                if (isBlank(((MappingConfig.Direct) config).sourceField())) {
                    violations.add("Direct mapping for " + field + " requires sourceField");
                }
            }
            case TRANSFORM -> {
                MappingConfig.Transform transform = (MappingConfig.Transform) config;
                if (isBlank(transform.sourceField()) || transform.transformations().isEmpty()) {
                    violations.add("Transform mapping for " + field + " requires sourceField and transformations");
                }
            }
            case CONDITIONAL -> {
                if (((MappingConfig.Conditional) config).conditions().isEmpty()) {
                    violations.add("Conditional mapping for " + field + " requires conditions");
                }
            }
            case COMPOSITE -> {
                if (((MappingConfig.Composite) config).sourceFields().isEmpty()) {
                    violations.add("Composite mapping for " + field + " requires sourceFields");
                }
            }
            case FLATTEN -> {
                MappingConfig.Flatten flatten = (MappingConfig.Flatten) config;
                if (isBlank(flatten.sourceField()) || isBlank(flatten.path())) {
                    violations.add("Flatten mapping for " + field + " requires sourceField and path");
                }
            }
            case LOOKUP -> {
                if (isBlank(((MappingConfig.Lookup) config).sourceField())) {
                    violations.add("Lookup mapping for " + field + " requires sourceField");
                }
            }
            case DEFAULT -> {
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
