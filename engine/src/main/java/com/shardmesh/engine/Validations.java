package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.shardmesh.core.schema.ValidationRule;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs a mapping's validation rules in order and reports the first one that fails.
 */
final class Validations {

    private Validations() {
    }

    static Optional<String> firstViolation(JsonNode value, List<ValidationRule> rules) {
        for (ValidationRule rule : rules) {
            if (violates(value, rule)) {
                return Optional.of(message(rule));
            }
        }
        return Optional.empty();
    }

    private static boolean violates(JsonNode value, ValidationRule rule) {
        JsonNode limit = rule.value() == null ? JsValues.undefined() : rule.value();

        return switch (rule.type()) {
            case REQUIRED -> JsValues.isNullish(value) || (value.isTextual() && value.textValue().isEmpty());
            case MIN -> below(JsValues.toNumber(value), JsValues.toNumber(limit));
            case MAX -> below(JsValues.toNumber(limit), JsValues.toNumber(value));
            case MIN_LENGTH -> below(JsValues.toJsString(value).length(), JsValues.toNumber(limit));
            case MAX_LENGTH -> below(JsValues.toNumber(limit), JsValues.toJsString(value).length());
            case PATTERN -> !pattern(limit).matcher(JsValues.toJsString(value)).find();
            case ENUM -> !limit.isArray() || !Conditions.includes(limit, value);
        };
    }

    /**
     * NaN on either side never violates, as with any comparison against NaN.
     */
    private static boolean below(double left, double right) {
        return left < right;
    }

    private static Pattern pattern(JsonNode limit) {
        String regex = JsValues.toJsString(limit);
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid validation pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    private static String message(ValidationRule rule) {
        if (rule.message() != null && !rule.message().isEmpty()) {
            return rule.message();
        }
        return "failed " + rule.type().wireName() + " validation";
    }
}
