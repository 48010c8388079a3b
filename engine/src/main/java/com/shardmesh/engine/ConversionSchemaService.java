package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.SchemaRepository;
import com.shardmesh.core.SchemaScope;
import com.shardmesh.core.Telemetry;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.FieldMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema lifecycle on top of a {@link SchemaRepository}: every write is validated first, and every
 * change is reported to telemetry.
 */
public class ConversionSchemaService {
    private static final Logger logger = LoggerFactory.getLogger(ConversionSchemaService.class);

    private final SchemaRepository repository;
    private final TransformEngine engine;
    private final SchemaValidator validator;
    private final Telemetry telemetry;

    public ConversionSchemaService(SchemaRepository repository, TransformEngine engine, SchemaValidator validator, Telemetry telemetry) {
        this.repository = repository;
        this.engine = engine;
        this.validator = validator;
        this.telemetry = telemetry;
    }

    public ConversionSchema create(ConversionSchema schema) {
        validator.check(schema);
        ConversionSchema created = repository.create(schema);
        telemetry.trackEvent("conversionSchema.created", event(created));
        logger.info("Created conversion schema {} in scope {}", created.id(), created.scope());
        return created;
    }

    /**
     * @param schema the edited schema, carrying the version it was read at
     * @return the stored schema, or empty when no schema has that id in the scope
     */
    public Optional<ConversionSchema> update(String id, SchemaScope scope, ConversionSchema schema) {
        ConversionSchema scoped = schema.toBuilder().id(id).scope(scope).build();
        validator.check(scoped);
        Optional<ConversionSchema> updated = repository.update(id, scope, scoped);
        updated.ifPresent(s -> telemetry.trackEvent("conversionSchema.updated", event(s)));
        return updated;
    }

    public boolean delete(String id, SchemaScope scope) {
        boolean deleted = repository.delete(id, scope);
        if (deleted) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("schemaId", id);
            properties.put("scope", scope.kind().name());
            if (scope.tenantId() != null) {
                properties.put("tenantId", scope.tenantId());
            }
            telemetry.trackEvent("conversionSchema.deleted", properties);
        }
        return deleted;
    }

    public Optional<ConversionSchema> findById(String id, SchemaScope scope) {
        return repository.findById(id, scope);
    }

    public List<ConversionSchema> list(SchemaScope scope) {
        return repository.list(scope);
    }

    public SchemaTestResult testSchema(String id, SchemaScope scope, JsonNode sample, Map<String, String> taskConfig) {
        Optional<ConversionSchema> found = repository.findById(id, scope);
        if (found.isEmpty()) {
            return SchemaTestResult.notFound();
        }
        ConversionSchema schema = found.get();
        TransformationContext context = new TransformationContext(scope.tenantId(), "", sample, taskConfig);

        List<SchemaTestResult.FieldReport> reports = new ArrayList<>();
        for (FieldMapping mapping : schema.fieldMappings()) {
            FieldResult result = engine.transformField(mapping, sample, context);
            reports.add(new SchemaTestResult.FieldReport(
                    mapping.targetField(),
                    engine.sourceValue(mapping, sample),
                    result.value(),
                    result.success(),
                    result.error()));
        }

        TransformResult overall = engine.transform(schema, sample, context);
        return new SchemaTestResult(overall.success(), overall.data(), reports, overall.errors());
    }

    private static Map<String, Object> event(ConversionSchema schema) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("schemaId", schema.id());
        properties.put("scope", schema.scope().kind().name());
        if (schema.scope().tenantId() != null) {
            properties.put("tenantId", schema.scope().tenantId());
        }
        properties.put("version", schema.version());
        properties.put("fieldMappingCount", schema.fieldMappings().size());
        return properties;
    }
}
