package com.shardmesh.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.engine.JsValues;

import java.util.function.IntPredicate;

/**
 * Compiled custom expression. The node set is closed: literals, references into the evaluation scope,
 * member reads, and operators. Nothing here can reach host code.
 */
public sealed interface Expr {

    JsonNode evaluate(ObjectNode scope);

    record Literal(JsonNode value) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            return value;
        }
    }

    record Reference(String name) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            if (!scope.has(name)) {
                throw new ExpressionException(name + " is not defined");
            }
            return scope.get(name);
        }
    }

    record Member(Expr target, String property) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            JsonNode owner = target.evaluate(scope);
            if (JsValues.isNullish(owner)) {
                throw new ExpressionException("Cannot read '" + property + "' of " + JsValues.toJsString(owner));
            }
            if ("length".equals(property)) {
                if (owner.isTextual()) {
                    return IntNode.valueOf(owner.textValue().length());
                }
                if (owner.isArray()) {
                    return IntNode.valueOf(owner.size());
                }
            }
            if (owner.isObject() && owner.has(property)) {
                return owner.get(property);
            }
            return JsValues.undefined();
        }
    }

    record Unary(UnaryOperator operator, Expr operand) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            JsonNode value = operand.evaluate(scope);
            return switch (operator) {
                case NOT -> BooleanNode.valueOf(!JsValues.truthy(value));
                case NEGATE -> JsValues.numberNode(-JsValues.toNumber(value));
                case PLUS -> JsValues.numberNode(JsValues.toNumber(value));
            };
        }
    }

    record Binary(BinaryOperator operator, Expr left, Expr right) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            JsonNode l = left.evaluate(scope);
            JsonNode r = right.evaluate(scope);
            return switch (operator) {
                case ADD -> add(l, r);
                case SUBTRACT -> JsValues.numberNode(JsValues.toNumber(l) - JsValues.toNumber(r));
                case MULTIPLY -> JsValues.numberNode(JsValues.toNumber(l) * JsValues.toNumber(r));
                case DIVIDE -> JsValues.numberNode(JsValues.toNumber(l) / JsValues.toNumber(r));
                case REMAINDER -> JsValues.numberNode(JsValues.toNumber(l) % JsValues.toNumber(r));
                case LESS -> relational(l, r, c -> c < 0);
                case LESS_EQUAL -> relational(l, r, c -> c <= 0);
                case GREATER -> relational(l, r, c -> c > 0);
                case GREATER_EQUAL -> relational(l, r, c -> c >= 0);
                case EQUAL -> BooleanNode.valueOf(JsValues.looseEquals(l, r));
                case NOT_EQUAL -> BooleanNode.valueOf(!JsValues.looseEquals(l, r));
                case STRICT_EQUAL -> BooleanNode.valueOf(JsValues.strictEquals(l, r));
                case STRICT_NOT_EQUAL -> BooleanNode.valueOf(!JsValues.strictEquals(l, r));
            };
        }

        private static JsonNode add(JsonNode l, JsonNode r) {
            boolean concatenate = isStringLike(l) || isStringLike(r);
            if (concatenate) {
                return TextNode.valueOf(JsValues.toJsString(l) + JsValues.toJsString(r));
            }
            return JsValues.numberNode(JsValues.toNumber(l) + JsValues.toNumber(r));
        }

        private static boolean isStringLike(JsonNode node) {
            return !JsValues.isUndefined(node) && (node.isTextual() || node.isContainerNode());
        }

        private static JsonNode relational(JsonNode l, JsonNode r, IntPredicate test) {
            Integer comparison = JsValues.compare(l, r);
            return BooleanNode.valueOf(comparison != null && test.test(comparison));
        }
    }

    /**
     * {@code &&} and {@code ||} yield one of their operands and only evaluate the right side when needed.
     */
    record Logical(boolean and, Expr left, Expr right) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            JsonNode l = left.evaluate(scope);
            if (and) {
                return JsValues.truthy(l) ? right.evaluate(scope) : l;
            }
            return JsValues.truthy(l) ? l : right.evaluate(scope);
        }
    }

    record Conditional(Expr test, Expr whenTrue, Expr whenFalse) implements Expr {
        @Override
        public JsonNode evaluate(ObjectNode scope) {
            return JsValues.truthy(test.evaluate(scope)) ? whenTrue.evaluate(scope) : whenFalse.evaluate(scope);
        }
    }

    enum UnaryOperator { NOT, NEGATE, PLUS }

    enum BinaryOperator {
        ADD, SUBTRACT, MULTIPLY, DIVIDE, REMAINDER,
        LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
        EQUAL, NOT_EQUAL, STRICT_EQUAL, STRICT_NOT_EQUAL
    }
}
