package com.shardmesh.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardmesh.engine.JsValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Screens, compiles and runs custom expressions. A rejected or failing expression yields an undefined
 * value; nothing is thrown to the caller.
 */
public class ExpressionEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);
    private static final int LOGGED_PREFIX = 100;

    private final ExpressionScreen screen;

    public ExpressionEvaluator(int maxLength) {
        this.screen = new ExpressionScreen(maxLength);
    }

    public JsonNode evaluate(String expression, ObjectNode scope) {
        Optional<String> rejection = screen.rejectionReason(expression);
        if (rejection.isPresent()) {
            logger.warn("Rejected custom expression '{}': {}", prefix(expression), rejection.get());
            return JsValues.undefined();
        }
        try {
            return ExpressionCompiler.compile(expression).evaluate(scope);
        } catch (ExpressionException e) {
            logger.warn("Custom expression '{}' failed: {}", prefix(expression), e.getMessage());
            return JsValues.undefined();
        }
    }

    private static String prefix(String expression) {
        if (expression == null) {
            return "";
        }
        return expression.length() > LOGGED_PREFIX ? expression.substring(0, LOGGED_PREFIX) : expression;
    }
}
