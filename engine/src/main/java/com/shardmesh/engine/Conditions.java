package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.schema.ConditionOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.StreamSupport;

/**
 * Evaluates the condition operators of conditional mappings. An operator never throws: values that
 * cannot be compared make the condition false.
 */
public final class Conditions {
    private static final Logger logger = LoggerFactory.getLogger(Conditions.class);

    private Conditions() {
    }

    /**
     * @param conditionValue the configured operand; {@code null} means none was configured
     */
    public static boolean evaluate(JsonNode fieldValue, ConditionOperator operator, JsonNode conditionValue) {
        JsonNode field = fieldValue == null ? JsValues.undefined() : fieldValue;
        JsonNode expected = conditionValue == null ? JsValues.undefined() : conditionValue;

        return switch (operator) {
            case EQ -> JsValues.strictEquals(field, expected);
            case NEQ -> !JsValues.strictEquals(field, expected);
            case GT -> relation(field, expected, c -> c > 0);
            case GTE -> relation(field, expected, c -> c >= 0);
            case LT -> relation(field, expected, c -> c < 0);
            case LTE -> relation(field, expected, c -> c <= 0);
            case CONTAINS -> JsValues.toJsString(field).contains(JsValues.toJsString(expected));
            case STARTS_WITH -> JsValues.toJsString(field).startsWith(JsValues.toJsString(expected));
            case ENDS_WITH -> JsValues.toJsString(field).endsWith(JsValues.toJsString(expected));
            case IN -> expected.isArray() && includes(expected, field);
            case NOT_IN -> expected.isArray() && !includes(expected, field);
            case EXISTS -> !JsValues.isNullish(field);
            case NOT_EXISTS -> JsValues.isNullish(field);
            case IS_NULL -> !JsValues.isUndefined(field) && field.isNull();
            case IS_NOT_NULL -> JsValues.isUndefined(field) || !field.isNull();
            case REGEX -> matches(field, expected);
        };
    }

    private static boolean relation(JsonNode left, JsonNode right, IntPredicate test) {
        Integer comparison = JsValues.compare(left, right);
        return comparison != null && test.test(comparison);
    }

    static boolean includes(JsonNode array, JsonNode value) {
        return StreamSupport.stream(array.spliterator(), false)
                .anyMatch(item -> JsValues.strictEquals(item, value));
    }

    private static boolean matches(JsonNode field, JsonNode pattern) {
        try {
            return Pattern.compile(JsValues.toJsString(pattern)).matcher(JsValues.toJsString(field)).find();
        } catch (PatternSyntaxException e) {
            logger.debug("regex condition with invalid pattern '{}' is false: {}", pattern, e.getDescription());
            return false;
        }
    }
}
