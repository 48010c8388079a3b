package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.schema.ConditionalRule;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import com.shardmesh.core.schema.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applies a conversion schema to one source record. Stateless and free of I/O, so it is safe to call
 * concurrently and to retry.
 */
public class TransformEngine {
    private static final Logger logger = LoggerFactory.getLogger(TransformEngine.class);
    static final String UNRESOLVED = "required value could not be resolved";

    private final Transformations transformations;

    public TransformEngine() {
        this(EngineConfig.defaults());
    }

    public TransformEngine(EngineConfig config) {
        this.transformations = new Transformations(config);
    }

    public TransformResult transform(ConversionSchema schema, JsonNode record, TransformationContext context) {
        TransformationContext scoped = context.sourceData() == null ? context.withSourceData(record) : context;
        ObjectNode data = Json.object();
        List<String> errors = new ArrayList<>();

        for (FieldMapping mapping : schema.fieldMappings()) {
            FieldResult result = transformField(mapping, record, scoped);
            if (result.hasValue()) {
                FieldPaths.write(data, mapping.targetField(), result.value().deepCopy());
            } else if (mapping.required()) {
                errors.add(mapping.targetField() + ": " + (result.success() ? UNRESOLVED : result.error()));
            } else if (!result.success()) {
                logger.debug("Optional field {} skipped: {}", mapping.targetField(), result.error());
            }
        }

        return errors.isEmpty() ? TransformResult.succeeded(data) : TransformResult.failed(errors);
    }

    public FieldResult transformField(FieldMapping mapping, JsonNode record, TransformationContext context) {
        try {
            JsonNode value = resolve(mapping, record, context);
            if (!JsValues.isNullish(value)) {
                Optional<String> violation = Validations.firstViolation(value, mapping.validation());
                if (violation.isPresent()) {
                    return FieldResult.failure(violation.get());
                }
            }
            return FieldResult.of(value);
        } catch (RuntimeException e) {
            logger.debug("Field {} failed to resolve", mapping.targetField(), e);
            return FieldResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private JsonNode resolve(FieldMapping mapping, JsonNode record, TransformationContext context) {
        MappingConfig config = mapping.config();
        if (config == null) {
            throw new IllegalArgumentException("mapping has no config");
        }

        return switch (config.kind()) {
            case DIRECT -> FieldPaths.read(record, ((MappingConfig.Direct) config).sourceField());
            case TRANSFORM -> {
                MappingConfig.Transform transform = (MappingConfig.Transform) config;
                yield transformations.applyAll(FieldPaths.read(record, transform.sourceField()), transform.transformations(), context);
            }
            case CONDITIONAL -> conditional((MappingConfig.Conditional) config, record, context);
            case DEFAULT -> TemplateDefaults.resolve(((MappingConfig.Default) config).value(), context.taskConfig());
            case COMPOSITE -> composite((MappingConfig.Composite) config, record);
            case FLATTEN -> {
                MappingConfig.Flatten flatten = (MappingConfig.Flatten) config;
                yield FieldPaths.read(record, flatten.sourceField() + "." + flatten.path());
            }
            case LOOKUP -> {
                MappingConfig.Lookup lookup = (MappingConfig.Lookup) config;
                logger.debug("No dictionary resolution configured for lookup on {}, passing {} through",
                        mapping.targetField(), lookup.sourceField());
                yield FieldPaths.read(record, lookup.sourceField());
            }
        };
    }

    private JsonNode conditional(MappingConfig.Conditional config, JsonNode record, TransformationContext context) {
        for (ConditionalRule rule : config.conditions()) {
            JsonNode fieldValue = FieldPaths.read(record, rule.condition().field());
            if (Conditions.evaluate(fieldValue, rule.condition().operator(), rule.condition().value())) {
                return outcome(rule.then(), record, context);
            }
        }
        return TemplateDefaults.resolve(config.defaultValue(), context.taskConfig());
    }

    private JsonNode outcome(Outcome outcome, JsonNode record, TransformationContext context) {
        return switch (outcome.type()) {
            case VALUE -> outcome.value() == null ? JsValues.undefined() : outcome.value();
            case FIELD, TRANSFORM -> transformations.applyAll(
                    FieldPaths.read(record, outcome.sourceField()), outcome.transformations(), context);
        };
    }

    /**
     * A {@code template} substitutes the first {@code ${field}} token of each source field; otherwise the
     * non-blank values are joined with {@code separator} (a space by default).
     */
    private static JsonNode composite(MappingConfig.Composite config, JsonNode record) {
        List<String> values = config.sourceFields().stream()
                .map(field -> FieldPaths.read(record, field))
                .map(value -> JsValues.isNullish(value) ? "" : JsValues.toJsString(value))
                .collect(Collectors.toList());

        if (config.template() != null && !config.template().isEmpty()) {
            String result = config.template();
            for (int i = 0; i < values.size(); i++) {
                result = replaceFirst(result, token(config.sourceFields().get(i)), values.get(i));
            }
            return TextNode.valueOf(result);
        }

        String separator = config.separator() == null || config.separator().isEmpty() ? " " : config.separator();
        return TextNode.valueOf(values.stream().filter(v -> !v.isEmpty()).collect(Collectors.joining(separator)));
    }

    private static String token(String field) {
        return "${" + field + "}";
    }

    private static String replaceFirst(String text, String target, String replacement) {
        int at = text.indexOf(target);
        return at < 0 ? text : text.substring(0, at) + replacement + text.substring(at + target.length());
    }

    /**
     * The raw input a mapping reads, for test-run reports.
     */
    public JsonNode sourceValue(FieldMapping mapping, JsonNode record) {
        MappingConfig config = mapping.config();
        if (config == null) {
            return JsValues.undefined();
        }
        return switch (config.kind()) {
            case DIRECT -> FieldPaths.read(record, ((MappingConfig.Direct) config).sourceField());
            case TRANSFORM -> FieldPaths.read(record, ((MappingConfig.Transform) config).sourceField());
            case FLATTEN -> FieldPaths.read(record, ((MappingConfig.Flatten) config).sourceField());
            case LOOKUP -> FieldPaths.read(record, ((MappingConfig.Lookup) config).sourceField());
            case DEFAULT -> JsValues.orNull(((MappingConfig.Default) config).value());
            case COMPOSITE -> {
                ArrayNode values = Json.NODES.arrayNode();
                ((MappingConfig.Composite) config).sourceFields()
                        .forEach(field -> values.add(missingToNull(FieldPaths.read(record, field))));
                yield values;
            }
            case CONDITIONAL -> {
                ArrayNode fields = Json.NODES.arrayNode();
                for (ConditionalRule rule : ((MappingConfig.Conditional) config).conditions()) {
                    ObjectNode entry = fields.addObject();
                    entry.put("field", rule.condition().field());
                    entry.set("value", missingToNull(FieldPaths.read(record, rule.condition().field())));
                }
                yield fields;
            }
        };
    }

    private static JsonNode missingToNull(JsonNode node) {
        return JsValues.isUndefined(node) ? Json.NODES.nullNode() : node;
    }
}
