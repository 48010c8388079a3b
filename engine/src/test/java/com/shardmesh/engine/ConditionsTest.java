package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.Json;
import org.junit.jupiter.api.Test;

import static com.shardmesh.core.schema.ConditionOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class ConditionsTest {
    private static final JsonNode UNDEFINED = MissingNode.getInstance();
    private static final JsonNode NULL = NullNode.getInstance();

    private static JsonNode text(String value) {
        return TextNode.valueOf(value);
    }

    private static JsonNode number(int value) {
        return IntNode.valueOf(value);
    }

    @Test
    void equalityIsStrict() {
        assertTrue(Conditions.evaluate(text("open"), EQ, text("open")));
        assertFalse(Conditions.evaluate(text("1"), EQ, number(1)));
        assertTrue(Conditions.evaluate(text("1"), NEQ, number(1)));
        assertTrue(Conditions.evaluate(number(1), EQ, Json.NODES.numberNode(1.0)));
    }

    @Test
    void relationalOperatorsCompareNumbersAndStrings() {
        assertTrue(Conditions.evaluate(number(10), GT, number(5)));
        assertTrue(Conditions.evaluate(text("10"), GTE, number(10)));
        assertTrue(Conditions.evaluate(text("apple"), LT, text("banana")));
        assertTrue(Conditions.evaluate(number(3), LTE, number(3)));
        assertFalse(Conditions.evaluate(text("abc"), GT, number(1)));
        assertFalse(Conditions.evaluate(UNDEFINED, LT, number(1)));
    }

    @Test
    void stringOperatorsStringifyBothSides() {
        assertTrue(Conditions.evaluate(text("Enterprise plan"), CONTAINS, text("plan")));
        assertTrue(Conditions.evaluate(number(12345), STARTS_WITH, text("123")));
        assertTrue(Conditions.evaluate(text("report.pdf"), ENDS_WITH, text(".pdf")));
        assertFalse(Conditions.evaluate(UNDEFINED, CONTAINS, text("x")));
    }

    @Test
    void membershipNeedsAnArray() {
        JsonNode allowed = Json.NODES.arrayNode().add("gold").add("silver");

        assertTrue(Conditions.evaluate(text("gold"), IN, allowed));
        assertFalse(Conditions.evaluate(text("bronze"), IN, allowed));
        assertTrue(Conditions.evaluate(text("bronze"), NOT_IN, allowed));
        assertFalse(Conditions.evaluate(text("gold"), IN, text("gold")));
        assertFalse(Conditions.evaluate(text("gold"), NOT_IN, text("silver")));
    }

    @Test
    void existenceAndNullChecks() {
        assertTrue(Conditions.evaluate(text(""), EXISTS, null));
        assertFalse(Conditions.evaluate(NULL, EXISTS, null));
        assertTrue(Conditions.evaluate(UNDEFINED, NOT_EXISTS, null));
        assertTrue(Conditions.evaluate(NULL, IS_NULL, null));
        assertFalse(Conditions.evaluate(UNDEFINED, IS_NULL, null));
        assertTrue(Conditions.evaluate(UNDEFINED, IS_NOT_NULL, null));
        assertFalse(Conditions.evaluate(NULL, IS_NOT_NULL, null));
    }

    @Test
    void regexMatchesAnywhereAndInvalidPatternIsFalse() {
        assertTrue(Conditions.evaluate(text("ORD-2024-001"), REGEX, text("\\d{4}")));
        assertFalse(Conditions.evaluate(text("ORD"), REGEX, text("^\\d+$")));
        assertFalse(Conditions.evaluate(text("anything"), REGEX, text("(unclosed")));
    }
}
