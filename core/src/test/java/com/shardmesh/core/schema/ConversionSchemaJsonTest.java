package com.shardmesh.core.schema;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.SchemaScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionSchemaJsonTest {
    private ConversionSchema schema;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/account-schema.json")) {
            schema = Json.MAPPER.readValue(in, ConversionSchema.class);
        }
    }

    @Test
    void readsScopeAndIdentity() {
        assertEquals("schema-accounts", schema.id());
        assertEquals(SchemaScope.tenant("tenant-a"), schema.scope());
        assertEquals("Account", schema.source().entity());
        assertEquals("account", schema.primaryShardTypeId());
        assertEquals("Id", schema.externalIdField());
        assertEquals("Name", schema.nameField());
        assertEquals(3, schema.version());
    }

    @Test
    void readsEveryMappingKind() {
        List<MappingKind> kinds = schema.fieldMappings().stream().map(m -> m.config().kind()).toList();

        assertEquals(List.of(MappingKind.DIRECT, MappingKind.TRANSFORM, MappingKind.CONDITIONAL, MappingKind.COMPOSITE,
                MappingKind.FLATTEN, MappingKind.DEFAULT, MappingKind.LOOKUP), kinds);
        assertTrue(schema.fieldMappings().get(0).required());
        assertFalse(schema.fieldMappings().get(1).required());
    }

    @Test
    void readsTransformationChainsAndValidation() {
        FieldMapping revenue = schema.fieldMappings().get(1);
        MappingConfig.Transform transform = (MappingConfig.Transform) revenue.config();

        assertEquals(List.of(TransformationType.TO_NUMBER, TransformationType.DIVIDE, TransformationType.ROUND),
                transform.transformations().stream().map(Transformation::type).toList());
        assertTrue(transform.transformations().get(0).config().isObject());
        assertEquals(1000, transform.transformations().get(1).config().get("divisor").intValue());

        ValidationRule rule = revenue.validation().get(0);
        assertEquals(ValidationType.MIN, rule.type());
        assertEquals("revenue cannot be negative", rule.message());
    }

    @Test
    void readsConditionalRules() {
        MappingConfig.Conditional tier = (MappingConfig.Conditional) schema.fieldMappings().get(2).config();

        assertEquals(ConditionOperator.GTE, tier.conditions().get(0).condition().operator());
        assertEquals(OutcomeKind.VALUE, tier.conditions().get(0).then().type());
        assertEquals(ConditionOperator.IN, tier.conditions().get(1).condition().operator());
        assertTrue(tier.conditions().get(1).condition().value().isArray());
        assertEquals("Industry", tier.conditions().get(1).then().sourceField());
        assertEquals("{{task.defaultTier}}", tier.defaultValue().asText());
    }

    @Test
    void readsDerivedTypesAndRelationships() {
        DerivedDescriptor contact = schema.derived().get(0);

        assertEquals("contact", contact.shardTypeId());
        assertTrue(contact.linkToPrimary());
        assertEquals("has_contact", contact.linkRelationshipType());
        assertEquals("PrimaryContact.Id", contact.dataExtraction().externalIdField());
        assertEquals(new ExtractedField("PrimaryContact.Email", "email"), contact.dataExtraction().fields().get(0));

        assertEquals(new RelationshipDeclaration("ParentId", "account", "child_of"), schema.relationships().get(0));
    }

    @Test
    void writesWireNamesBack() {
        JsonNode written = Json.MAPPER.valueToTree(schema);

        JsonNode revenue = written.get("fieldMappings").get(1).get("config");
        assertEquals("transform", revenue.get("type").asText());
        assertEquals("to_number", revenue.get("transformations").get(0).get("type").asText());
        assertEquals("gte", written.get("fieldMappings").get(2).get("config").get("conditions").get(0)
                .get("condition").get("operator").asText());
        assertEquals("TENANT", written.get("scope").get("kind").asText());
        assertFalse(written.get("scope").has("global"));
        assertFalse(written.has("primaryShardTypeId"));
    }

    @Test
    void unknownOperatorsAreRejected() {
        String document = "{\"type\": \"explode\"}";

        assertThrows(JsonMappingException.class, () -> Json.MAPPER.readValue(document, Transformation.class));
    }
}
