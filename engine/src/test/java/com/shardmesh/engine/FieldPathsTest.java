package com.shardmesh.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldPathsTest {

    @Test
    void readFollowsDottedPaths() {
        ObjectNode record = Json.object();
        record.putObject("owner").putObject("address").put("city", "Leeds");

        assertEquals("Leeds", FieldPaths.read(record, "owner.address.city").asText());
        assertTrue(FieldPaths.read(record, "owner.phone").isMissingNode());
    }

    @Test
    void readStopsAtNullAncestorsAndArrays() {
        ObjectNode record = Json.object();
        record.putNull("owner");
        record.putArray("tags").add("a");

        assertTrue(FieldPaths.read(record, "owner.name").isMissingNode());
        assertTrue(FieldPaths.read(record, "tags.0").isMissingNode());
        assertTrue(FieldPaths.read(record, "owner").isNull());
    }

    @Test
    void writeCreatesAndReplacesIntermediates() {
        ObjectNode out = Json.object();
        out.put("contact", "flat value");

        FieldPaths.write(out, "contact.email", TextNode.valueOf("a@b.c"));
        FieldPaths.write(out, "contact.phone", TextNode.valueOf("123"));

        assertEquals("a@b.c", out.get("contact").get("email").asText());
        assertEquals("123", out.get("contact").get("phone").asText());
    }
}
