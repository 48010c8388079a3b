package com.shardmesh.materializer.steps;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.schema.FieldMapping;
import com.shardmesh.core.schema.MappingConfig;
import com.shardmesh.core.schema.Transformation;
import com.shardmesh.engine.TransformationContext;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformationSteps {
    private static final TypeReference<List<Transformation>> CHAIN = new TypeReference<>() {
    };

    private final MaterializationWorld world;

    public TransformationSteps(MaterializationWorld world) {
        this.world = world;
    }

    @When("the text {string} is transformed with:")
    public void theTextIsTransformedWith(String text, String chain) throws IOException {
        transform(Json.object().put("value", text), chain);
    }

    @When("the number {double} is transformed with:")
    public void theNumberIsTransformedWith(double number, String chain) throws IOException {
        transform(Json.object().put("value", number), chain);
    }

    private void transform(ObjectNode record, String chain) throws IOException {
        List<Transformation> transformations = Json.MAPPER.readValue(chain, CHAIN);
        FieldMapping mapping = FieldMapping.optional("result", new MappingConfig.Transform("value", transformations));
        world.input = record.get("value");
        world.fieldResult = world.engine.transformField(mapping, record,
                TransformationContext.of(world.tenantId, world.integrationId));
    }

    @Then("the field resolves to the text {string}")
    public void theFieldResolvesToTheText(String expected) {
        assertTrue(world.fieldResult.success(), world.fieldResult.error());
        assertEquals(expected, world.fieldResult.value().textValue());
    }

    @Then("the field resolves to the original input")
    public void theFieldResolvesToTheOriginalInput() {
        assertTrue(world.fieldResult.success(), world.fieldResult.error());
        assertEquals(world.input, world.fieldResult.value());
    }

    @Then("the field is left undefined")
    public void theFieldIsLeftUndefined() {
        assertTrue(world.fieldResult.success(), world.fieldResult.error());
        assertFalse(world.fieldResult.hasValue());
    }
}
