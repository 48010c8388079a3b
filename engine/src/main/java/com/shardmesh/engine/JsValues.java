package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Loose-typing rules for record values, the way integration payloads expect them to behave:
 * {@code "12"} is a number when arithmetic needs one, a missing value prints as {@code undefined},
 * and {@code 1.0} prints as {@code 1}.
 * <p>
 * A {@link MissingNode} is an undefined value; a {@link NullNode} is an explicit null.
 */
public final class JsValues {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?)");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final double MAX_SAFE_INTEGER = 9007199254740991d;

    private JsValues() {
    }

    public static boolean isUndefined(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    public static boolean isNullish(JsonNode node) {
        return isUndefined(node) || node.isNull();
    }

    public static JsonNode undefined() {
        return MissingNode.getInstance();
    }

    public static double toNumber(JsonNode node) {
        if (isUndefined(node)) {
            return Double.NaN;
        }
        if (node.isNull()) {
            return 0;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return parseNumber(node.textValue());
        }
        if (node.isArray()) {
            return parseNumber(toJsString(node));
        }
        return Double.NaN;
    }

    static double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        switch (trimmed) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (HEX.matcher(trimmed).matches()) {
            return new BigInteger(trimmed.substring(2), 16).doubleValue();
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return Double.NaN;
    }

    public static String toJsString(JsonNode node) {
        if (isUndefined(node)) {
            return "undefined";
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return Boolean.toString(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Long.toString(node.longValue());
        }
        if (node.isNumber()) {
            return formatNumber(node.doubleValue());
        }
        if (node.isArray()) {
            return StreamSupport.stream(node.spliterator(), false)
                    .map(item -> isNullish(item) ? "" : toJsString(item))
                    .collect(Collectors.joining(","));
        }
        return "[object Object]";
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e21) {
            return new BigDecimal(value).toPlainString();
        }
        return Double.toString(value);
    }

    /**
     * A number node for an arithmetic result: integral values become integer nodes so {@code 10 / 2}
     * yields {@code 5}, not {@code 5.0}.
     */
    public static JsonNode numberNode(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            long asLong = (long) value;
            if (asLong == 0 && 1 / value < 0) {
                return DoubleNode.valueOf(value);
            }
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) asLong);
            }
            return LongNode.valueOf(asLong);
        }
        return DoubleNode.valueOf(value);
    }

    public static boolean truthy(JsonNode node) {
        if (isNullish(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double d = node.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return true;
    }

    /**
     * Identity comparison without coercion. Scalars compare by value; numbers compare numerically so
     * {@code 1} equals {@code 1.0}. Objects and arrays are never equal to one another.
     */
    public static boolean strictEquals(JsonNode left, JsonNode right) {
        if (isUndefined(left) || isUndefined(right)) {
            return isUndefined(left) && isUndefined(right);
        }
        if (left.isNull() || right.isNull()) {
            return left.isNull() && right.isNull();
        }
        if (left.isNumber() && right.isNumber()) {
            return left.doubleValue() == right.doubleValue();
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        if (left.isBoolean() && right.isBoolean()) {
            return left.booleanValue() == right.booleanValue();
        }
        return false;
    }

    public static boolean looseEquals(JsonNode left, JsonNode right) {
        if (isNullish(left) || isNullish(right)) {
            return isNullish(left) && isNullish(right);
        }
        if (left.isContainerNode() || right.isContainerNode()) {
            if (left.isContainerNode() && right.isContainerNode()) {
                return false;
            }
            JsonNode container = left.isContainerNode() ? left : right;
            JsonNode other = left.isContainerNode() ? right : left;
            return looseEquals(TextNode.valueOf(toJsString(container)), other);
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        return toNumber(left) == toNumber(right);
    }

    /**
     * Relational comparison: two strings compare lexically, anything else numerically. Returns null when
     * the values are not comparable (a NaN operand), so every relational operator is false.
     */
    public static Integer compare(JsonNode left, JsonNode right) {
        if (!isUndefined(left) && !isUndefined(right) && left.isTextual() && right.isTextual()) {
            return Integer.signum(left.textValue().compareTo(right.textValue()));
        }
        double l = toNumber(left);
        double r = toNumber(right);
        if (Double.isNaN(l) || Double.isNaN(r)) {
            return null;
        }
        return Double.compare(l, r) == 0 ? 0 : (l < r ? -1 : 1);
    }

    public static JsonNode orNull(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }
}
