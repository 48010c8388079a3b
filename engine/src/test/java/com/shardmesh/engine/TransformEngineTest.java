package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.SchemaScope;
import com.shardmesh.core.schema.Condition;
import com.shardmesh.core.schema.ConditionOperator;
import com.shardmesh.core.schema.ConditionalRule;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import com.shardmesh.core.schema.Outcome;
import com.shardmesh.core.schema.Transformation;
import com.shardmesh.core.schema.TransformationType;
import com.shardmesh.core.schema.ValidationRule;
import com.shardmesh.core.schema.ValidationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformEngineTest {
    private TransformEngine engine;
    private ObjectNode record;
    private TransformationContext context;

    @BeforeEach
    void setUp() {
        engine = new TransformEngine();
        record = Json.object()
                .put("Id", "0015g00000XyZ")
                .put("Name", "  Acme Corp ")
                .put("FirstName", "Ada")
                .put("LastName", "Lovelace")
                .put("Amount", "1250.456")
                .put("Stage", "Closed Won");
        record.putObject("Owner").put("Email", "owner@acme.test");
        record.putObject("Billing").put("City", "");
        context = new TransformationContext("tenant-a", "crm", null, Map.of("region", "EMEA"));
    }

    private static ConversionSchema schema(FieldMapping... mappings) {
        ConversionSchema.Builder builder = ConversionSchema.builder()
                .scope(SchemaScope.tenant("tenant-a"))
                .name("Accounts")
                .targetShardType("account");
        for (FieldMapping mapping : mappings) {
            builder.fieldMapping(mapping);
        }
        return builder.build();
    }

    @Test
    void directAndFlattenReadNestedFields() {
        TransformResult result = engine.transform(schema(
                FieldMapping.required("externalId", new MappingConfig.Direct("Id")),
                FieldMapping.optional("owner.email", new MappingConfig.Flatten("Owner", "Email"))), record, context);

        assertTrue(result.success());
        ObjectNode data = result.data().orElseThrow();
        assertEquals("0015g00000XyZ", data.get("externalId").asText());
        assertEquals("owner@acme.test", data.get("owner").get("email").asText());
    }

    @Test
    void transformChainsRunLeftToRight() {
        TransformResult result = engine.transform(schema(
                FieldMapping.required("name", new MappingConfig.Transform("Name", List.of(
                        Transformation.of(TransformationType.TRIM),
                        Transformation.of(TransformationType.UPPERCASE)))),
                FieldMapping.optional("amount", new MappingConfig.Transform("Amount", List.of(
                        Transformation.of(TransformationType.TO_NUMBER),
                        Transformation.of(TransformationType.ROUND, Json.object().put("decimals", 1)))))), record, context);

        ObjectNode data = result.data().orElseThrow();
        assertEquals("ACME CORP", data.get("name").asText());
        assertEquals(1250.5, data.get("amount").doubleValue());
    }

    @Test
    void conditionalTakesTheFirstMatchingRule() {
        MappingConfig.Conditional status = new MappingConfig.Conditional(List.of(
                new ConditionalRule(new Condition("Stage", ConditionOperator.STARTS_WITH, TextNode.valueOf("Closed Lost")),
                        Outcome.value(TextNode.valueOf("lost"))),
                new ConditionalRule(new Condition("Stage", ConditionOperator.STARTS_WITH, TextNode.valueOf("Closed")),
                        Outcome.value(TextNode.valueOf("won"))),
                new ConditionalRule(new Condition("Stage", ConditionOperator.EXISTS, null),
                        Outcome.value(TextNode.valueOf("open")))),
                TextNode.valueOf("unknown"));

        TransformResult result = engine.transform(schema(FieldMapping.required("status", status)), record, context);

        assertEquals("won", result.data().orElseThrow().get("status").asText());
    }

    @Test
    void conditionalOutcomesCanCopyAndTransformFields() {
        MappingConfig.Conditional copy = new MappingConfig.Conditional(List.of(
                new ConditionalRule(new Condition("Stage", ConditionOperator.EQ, TextNode.valueOf("Closed Won")),
                        Outcome.transform("Name", List.of(Transformation.of(TransformationType.TRIM))))),
                null);
        MappingConfig.Conditional field = new MappingConfig.Conditional(List.of(
                new ConditionalRule(new Condition("Stage", ConditionOperator.EXISTS, null), Outcome.field("FirstName"))),
                null);

        ObjectNode data = engine.transform(schema(
                FieldMapping.required("account", copy),
                FieldMapping.required("first", field)), record, context).data().orElseThrow();

        assertEquals("Acme Corp", data.get("account").asText());
        assertEquals("Ada", data.get("first").asText());
    }

    @Test
    void conditionalDefaultResolvesTaskTemplates() {
        MappingConfig.Conditional region = new MappingConfig.Conditional(List.of(
                new ConditionalRule(new Condition("Country", ConditionOperator.EQ, TextNode.valueOf("US")),
                        Outcome.value(TextNode.valueOf("AMER")))),
                TextNode.valueOf("{{task.region}}/{{task.unknown}}"));

        ObjectNode data = engine.transform(schema(FieldMapping.required("region", region)), record, context).data().orElseThrow();

        assertEquals("EMEA/{{task.unknown}}", data.get("region").asText());
    }

    @Test
    void defaultMappingsKeepNonTextValues() {
        ObjectNode data = engine.transform(schema(
                FieldMapping.required("source", new MappingConfig.Default(TextNode.valueOf("crm:{{task.region}}"))),
                FieldMapping.required("priority", new MappingConfig.Default(IntNode.valueOf(3)))), record, context)
                .data().orElseThrow();

        assertEquals("crm:EMEA", data.get("source").asText());
        assertEquals(3, data.get("priority").intValue());
    }

    @Test
    void compositeJoinsNonBlankValuesOrFillsATemplate() {
        ObjectNode data = engine.transform(schema(
                FieldMapping.required("fullName", new MappingConfig.Composite(List.of("FirstName", "Billing.City", "LastName"), null, null)),
                FieldMapping.required("label", new MappingConfig.Composite(List.of("LastName", "FirstName"), null, "${LastName}, ${FirstName}")),
                FieldMapping.required("path", new MappingConfig.Composite(List.of("FirstName", "LastName"), "/", null))), record, context)
                .data().orElseThrow();

        assertEquals("Ada Lovelace", data.get("fullName").asText());
        assertEquals("Lovelace, Ada", data.get("label").asText());
        assertEquals("Ada/Lovelace", data.get("path").asText());
    }

    @Test
    void lookupPassesTheSourceValueThrough() {
        ObjectNode data = engine.transform(schema(
                FieldMapping.required("stage", new MappingConfig.Lookup("Stage", "stages"))), record, context).data().orElseThrow();

        assertEquals("Closed Won", data.get("stage").asText());
    }

    @Test
    void missingRequiredFieldFailsTheRecord() {
        TransformResult result = engine.transform(schema(
                FieldMapping.required("externalId", new MappingConfig.Direct("Id")),
                FieldMapping.required("industry", new MappingConfig.Direct("Industry"))), record, context);

        assertFalse(result.success());
        assertTrue(result.data().isEmpty());
        assertEquals(List.of("industry: required value could not be resolved"), result.errors());
    }

    @Test
    void missingOptionalFieldIsOmitted() {
        TransformResult result = engine.transform(schema(
                FieldMapping.optional("industry", new MappingConfig.Direct("Industry"))), record, context);

        assertTrue(result.success());
        assertFalse(result.data().orElseThrow().has("industry"));
    }

    @Test
    void firstFailingValidationRuleReportsItsMessage() {
        FieldMapping mapping = new FieldMapping("amount",
                new MappingConfig.Transform("Amount", List.of(Transformation.of(TransformationType.TO_NUMBER))),
                List.of(
                        new ValidationRule(ValidationType.MIN, IntNode.valueOf(0), "amount must be positive"),
                        new ValidationRule(ValidationType.MAX, IntNode.valueOf(1000), "amount too large"),
                        new ValidationRule(ValidationType.MAX, IntNode.valueOf(10), "never reached")),
                true);

        TransformResult result = engine.transform(schema(mapping), record, context);

        assertEquals(List.of("amount: amount too large"), result.errors());
    }

    @Test
    void validationRulesCoverLengthPatternAndEnum() {
        FieldResult tooShort = engine.transformField(new FieldMapping("first", new MappingConfig.Direct("FirstName"),
                List.of(new ValidationRule(ValidationType.MIN_LENGTH, IntNode.valueOf(5), "too short")), true), record, context);
        FieldResult badPattern = engine.transformField(new FieldMapping("email", new MappingConfig.Flatten("Owner", "Email"),
                List.of(new ValidationRule(ValidationType.PATTERN, TextNode.valueOf("^[^@]+@example\\.com$"), "wrong domain")), true), record, context);
        FieldResult notAllowed = engine.transformField(new FieldMapping("stage", new MappingConfig.Direct("Stage"),
                List.of(new ValidationRule(ValidationType.ENUM, Json.NODES.arrayNode().add("Open"), "bad stage")), true), record, context);
        FieldResult passes = engine.transformField(new FieldMapping("last", new MappingConfig.Direct("LastName"),
                List.of(new ValidationRule(ValidationType.MAX_LENGTH, IntNode.valueOf(20), "too long"),
                        new ValidationRule(ValidationType.REQUIRED, null, "needed")), true), record, context);

        assertEquals("too short", tooShort.error());
        assertEquals("wrong domain", badPattern.error());
        assertEquals("bad stage", notAllowed.error());
        assertTrue(passes.success());
        assertEquals("Lovelace", passes.value().asText());
    }

    @Test
    void invalidValidationPatternFailsTheMapping() {
        FieldResult result = engine.transformField(new FieldMapping("first", new MappingConfig.Direct("FirstName"),
                List.of(new ValidationRule(ValidationType.PATTERN, TextNode.valueOf("(unclosed"), "bad")), true), record, context);

        assertFalse(result.success());
        assertTrue(result.error().contains("(unclosed"));
    }

    @Test
    void validationSkipsUndefinedValues() {
        FieldResult result = engine.transformField(new FieldMapping("industry", new MappingConfig.Direct("Industry"),
                List.of(new ValidationRule(ValidationType.REQUIRED, null, "needed")), false), record, context);

        assertTrue(result.success());
        assertFalse(result.hasValue());
    }

    @Test
    void customExpressionCanReadTheRecord() {
        FieldMapping mapping = FieldMapping.required("weighted", new MappingConfig.Transform("Amount", List.of(
                Transformation.of(TransformationType.TO_NUMBER),
                Transformation.of(TransformationType.CUSTOM, Json.object().put("expression",
                        "sourceData.Stage === 'Closed Won' ? value : value / 2")))));

        JsonNode weighted = engine.transform(schema(mapping), record, context).data().orElseThrow().get("weighted");

        assertEquals(1250.456, weighted.doubleValue());
    }

    @Test
    void rejectedCustomExpressionMakesARequiredFieldFailWithoutThrowing() {
        FieldMapping mapping = FieldMapping.required("hack", new MappingConfig.Transform("Name", List.of(
                Transformation.of(TransformationType.CUSTOM, Json.object().put("expression", "require(\"fs\")")))));

        TransformResult result = engine.transform(schema(mapping), record, context);

        assertFalse(result.success());
        assertEquals(List.of("hack: required value could not be resolved"), result.errors());
    }

    @Test
    void transformIsRepeatable() {
        ConversionSchema schema = schema(
                FieldMapping.required("name", new MappingConfig.Transform("Name", List.of(Transformation.of(TransformationType.TRIM)))));

        TransformResult first = engine.transform(schema, record, context);
        TransformResult second = engine.transform(schema, record, context);

        assertEquals(first.data(), second.data());
        assertEquals("  Acme Corp ", record.get("Name").asText());
    }

    @Test
    void nestedTargetsNeverWriteBackIntoTheRecord() {
        ObjectNode source = Json.object().put("Id", "1");
        source.putObject("address").put("city", "Paris");
        ObjectNode before = source.deepCopy();

        ObjectNode data = engine.transform(schema(
                FieldMapping.required("address", new MappingConfig.Direct("address")),
                FieldMapping.required("address.country", new MappingConfig.Default(TextNode.valueOf("FR")))), source, context)
                .data().orElseThrow();

        assertEquals("FR", data.get("address").get("country").asText());
        assertEquals("Paris", data.get("address").get("city").asText());
        assertEquals(before, source);
    }
}
