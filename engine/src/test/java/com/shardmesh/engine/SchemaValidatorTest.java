package com.shardmesh.engine;

import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.SchemaScope;
import com.shardmesh.core.SchemaValidationException;
import com.shardmesh.core.schema.ConversionSchema;
import com.shardmesh.core.schema.DataExtraction;
import com.shardmesh.core.schema.DerivedDescriptor;
import com.shardmesh.core.schema.ExtractedField;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import com.shardmesh.core.schema.OutputShardTypes;
import com.shardmesh.core.schema.RelationshipDeclaration;
import com.shardmesh.core.schema.Transformation;
import com.shardmesh.core.schema.TransformationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {
    private SchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
    }

    private static ConversionSchema.Builder valid() {
        return ConversionSchema.builder()
                .scope(SchemaScope.tenant("tenant-a"))
                .name("Salesforce accounts")
                .sourceEntity("Account")
                .targetShardType("account")
                .fieldMapping(FieldMapping.required("externalId", new MappingConfig.Direct("Id")))
                .fieldMapping(FieldMapping.optional("name", new MappingConfig.Transform("Name",
                        List.of(Transformation.of(TransformationType.TRIM)))));
    }

    @Test
    void acceptsAWellFormedSchema() {
        ConversionSchema schema = valid()
                .outputShardTypes(new OutputShardTypes("account", List.of(new DerivedDescriptor("contact",
                        new DataExtraction(List.of(new ExtractedField("PrimaryContact.Email", "email")), "PrimaryContact.Id", null),
                        true, "has_contact"))))
                .relationship(new RelationshipDeclaration("ParentId", "account", "child_of"))
                .build();

        assertEquals(List.of(), validator.violations(schema));
        assertDoesNotThrow(() -> validator.check(schema));
    }

    @Test
    void rejectsDuplicateTargetFields() {
        ConversionSchema schema = valid()
                .fieldMapping(FieldMapping.optional("name", new MappingConfig.Direct("AccountName")))
                .build();

        SchemaValidationException e = assertThrows(SchemaValidationException.class, () -> validator.check(schema));
        assertEquals(List.of("Duplicate target field: name"), e.violations());
    }

    @Test
    void reportsMissingKindSpecificFields() {
        ConversionSchema schema = valid()
                .fieldMappings(List.of(
                        FieldMapping.optional("a", new MappingConfig.Direct(null)),
                        FieldMapping.optional("b", new MappingConfig.Transform("X", List.of())),
                        FieldMapping.optional("c", new MappingConfig.Conditional(List.of(), TextNode.valueOf("x"))),
                        FieldMapping.optional("d", new MappingConfig.Composite(List.of(), null, null)),
                        FieldMapping.optional("e", new MappingConfig.Flatten("Owner", " ")),
                        FieldMapping.optional("f", new MappingConfig.Lookup("", "dict"))))
                .build();

        List<String> violations = validator.violations(schema);

        assertEquals(List.of(
                "Direct mapping for a requires sourceField",
                "Transform mapping for b requires sourceField and transformations",
                "Conditional mapping for c requires conditions",
                "Composite mapping for d requires sourceFields",
                "Flatten mapping for e requires sourceField and path",
                "Lookup mapping for f requires sourceField"), violations);
    }

    @Test
    void requiresAPrimaryShardType() {
        ConversionSchema schema = valid().target(null).build();

        assertTrue(validator.violations(schema).contains("A primary output shard type is required"));
    }

    @Test
    void outputShardTypesCanNameThePrimaryType() {
        ConversionSchema schema = valid().target(null)
                .outputShardTypes(new OutputShardTypes("account", null))
                .build();

        assertEquals(List.of(), validator.violations(schema));
    }

    @Test
    void requiresAScope() {
        ConversionSchema schema = valid().scope(null).build();

        assertTrue(validator.violations(schema).contains("Schema scope is required"));
    }

    @Test
    void rejectsAnEmptyName() {
        ConversionSchema schema = valid().name("").build();

        List<String> violations = validator.violations(schema);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("name"), violations.get(0));
    }

    @Test
    void rejectsAMissingName() {
        ConversionSchema schema = valid().name(null).build();

        assertFalse(validator.violations(schema).isEmpty());
    }

    @Test
    void capsTransformationChains() {
        List<Transformation> chain = Collections.nCopies(51, Transformation.of(TransformationType.TRIM));
        ConversionSchema schema = valid()
                .fieldMapping(FieldMapping.optional("long", new MappingConfig.Transform("Name", chain)))
                .build();

        assertFalse(validator.violations(schema).isEmpty());
    }

    @Test
    void derivedTypesNeedAnIdAndALinkType() {
        ConversionSchema schema = valid()
                .outputShardTypes(new OutputShardTypes("account", List.of(
                        new DerivedDescriptor(null, null, false, null),
                        new DerivedDescriptor("contact", null, true, null))))
                .build();

        assertEquals(List.of(
                "Derived shard type requires shardTypeId",
                "Derived shard type contact links to primary without linkRelationshipType"), validator.violations(schema));
    }

    @Test
    void relationshipsNeedEveryField() {
        ConversionSchema schema = valid()
                .relationship(new RelationshipDeclaration("OwnerId", null, "owned_by"))
                .build();

        assertEquals(List.of("Relationship requires targetExternalIdField, targetShardTypeId and relationshipType"),
                validator.violations(schema));
    }

    @Test
    void mappingsNeedATargetField() {
        ConversionSchema schema = valid()
                .fieldMapping(FieldMapping.optional(" ", new MappingConfig.Direct("Id")))
                .build();

        assertTrue(validator.violations(schema).contains("Field mapping requires targetField"));
    }
}
