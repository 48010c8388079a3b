package com.shardmesh.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.core.Json;
import com.shardmesh.core.schema.Transformation;
import com.shardmesh.core.schema.TransformationType;
import com.shardmesh.engine.expression.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The transformation operators. Every operator is a pure function of the value, its config and the
 * context; bad input degrades to a documented fallback and is logged, never thrown.
 * <p>
 * Null and undefined values pass through every operator unchanged.
 */
public class Transformations {
    private static final Logger logger = LoggerFactory.getLogger(Transformations.class);
    private static final Set<String> TRUTHY_STRINGS = Set.of("true", "1", "yes", "on");
    private static final int MAX_ROUND_DECIMALS = 20;

    private final EngineConfig config;
    private final ExpressionEvaluator expressions;

    public Transformations(EngineConfig config) {
        this.config = config;
        this.expressions = new ExpressionEvaluator(config.maxExpressionLength());
    }

    public JsonNode applyAll(JsonNode value, List<Transformation> chain, TransformationContext context) {
        JsonNode current = value;
        for (Transformation transformation : chain) {
            current = apply(current, transformation, context);
        }
        return current;
    }

    public JsonNode apply(JsonNode value, Transformation transformation, TransformationContext context) {
        if (JsValues.isNullish(value)) {
            return value;
        }
        JsonNode cfg = transformation.config();

        return switch (transformation.type()) {
            case UPPERCASE -> TextNode.valueOf(JsValues.toJsString(value).toUpperCase(Locale.ROOT));
            case LOWERCASE -> TextNode.valueOf(JsValues.toJsString(value).toLowerCase(Locale.ROOT));
            case TRIM -> TextNode.valueOf(JsValues.toJsString(value).strip());
            case TRUNCATE -> truncate(value, cfg);
            case REPLACE -> replace(value, text(cfg, "search", ""), "g", text(cfg, "replace", ""), "replace");
            case REGEX_REPLACE -> replace(value, text(cfg, "pattern", ""), text(cfg, "flags", "g"),
                    text(cfg, "replace", ""), "regex_replace");
            case SPLIT -> split(value, cfg);
            case CONCAT -> TextNode.valueOf(text(cfg, "prefix", "") + JsValues.toJsString(value) + text(cfg, "suffix", ""));

            case ROUND -> round(value, cfg);
            case FLOOR -> numeric(value, Math::floor);
            case CEIL -> numeric(value, Math::ceil);
            case MULTIPLY -> numeric(value, n -> n * finiteNumber(cfg, "factor", 1));
            case DIVIDE -> divide(value, cfg);
            case ADD -> numeric(value, n -> n + finiteNumber(cfg, "amount", 0));
            case SUBTRACT -> numeric(value, n -> n - finiteNumber(cfg, "amount", 0));
            case ABS -> numeric(value, Math::abs);
            case CURRENCY_CONVERT -> numeric(value, n -> n * finiteNumber(cfg, "rate", 1));

            case PARSE_DATE -> date(value, "parse_date")
                    .<JsonNode>map(d -> TextNode.valueOf(JsDates.toIsoString(d)))
                    .orElse(value);
            case FORMAT_DATE -> date(value, "format_date")
                    .<JsonNode>map(d -> TextNode.valueOf(JsDates.format(d, text(cfg, "format", "YYYY-MM-DD"), config.zone())))
                    .orElse(TextNode.valueOf(JsValues.toJsString(value)));
            case ADD_DAYS -> shiftDays(value, (long) finiteNumber(cfg, "days", 0), "add_days");
            case SUBTRACT_DAYS -> shiftDays(value, -(long) finiteNumber(cfg, "days", 0), "subtract_days");
            case TO_TIMESTAMP -> date(value, "to_timestamp")
                    .<JsonNode>map(d -> JsValues.numberNode(d.toEpochMilli()))
                    .orElse(IntNode.valueOf(0));
            case TO_ISO_STRING -> date(value, "to_iso_string")
                    .<JsonNode>map(d -> TextNode.valueOf(JsDates.toIsoString(d)))
                    .orElse(TextNode.valueOf(JsValues.toJsString(value)));
            case EXTRACT_YEAR -> date(value, "extract_year")
                    .<JsonNode>map(d -> IntNode.valueOf(JsDates.inZone(d, config.zone()).getYear()))
                    .orElse(IntNode.valueOf(0));
            case EXTRACT_MONTH -> date(value, "extract_month")
                    .<JsonNode>map(d -> IntNode.valueOf(JsDates.inZone(d, config.zone()).getMonthValue()))
                    .orElse(IntNode.valueOf(0));
            case EXTRACT_DAY -> date(value, "extract_day")
                    .<JsonNode>map(d -> IntNode.valueOf(JsDates.inZone(d, config.zone()).getDayOfMonth()))
                    .orElse(IntNode.valueOf(0));

            case TO_STRING -> TextNode.valueOf(JsValues.toJsString(value));
            case TO_NUMBER -> toNumber(value);
            case TO_BOOLEAN -> toBoolean(value);
            case TO_ARRAY -> value.isArray() ? value : Json.NODES.arrayNode().add(value);
            case TO_DATE -> JsDates.parse(value, config.zone())
                    .<JsonNode>map(d -> TextNode.valueOf(JsDates.toIsoString(d)))
                    .orElse(NullNode.getInstance());
            case PARSE_JSON -> parseJson(value);
            case STRINGIFY_JSON -> stringifyJson(value);

            case CUSTOM -> custom(value, cfg, context);
        };
    }

    private JsonNode truncate(JsonNode value, JsonNode cfg) {
        String text = JsValues.toJsString(value);
        JsonNode requested = cfg.get("maxLength");
        int maxLength = config.defaultTruncateLength();
        if (requested != null && requested.isNumber() && requested.doubleValue() > 0) {
            maxLength = (int) Math.min(requested.doubleValue(), config.truncateCap());
        }
        return TextNode.valueOf(text.length() > maxLength ? text.substring(0, maxLength) : text);
    }

    private JsonNode replace(JsonNode value, String pattern, String flags, String replacement, String operation) {
        try {
            Pattern compiled = Pattern.compile(pattern, patternFlags(flags));
            Matcher matcher = compiled.matcher(JsValues.toJsString(value));
            String javaReplacement = toJavaReplacement(replacement);
            String result = flags.contains("g") ? matcher.replaceAll(javaReplacement) : matcher.replaceFirst(javaReplacement);
            return TextNode.valueOf(result);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            logger.debug("{} kept the original value, bad pattern '{}': {}", operation, pattern, e.getMessage());
            return value;
        }
    }

    private static int patternFlags(String flags) {
        int result = 0;
        for (char flag : flags.toCharArray()) {
            switch (flag) {
                case 'g':
                    break;
                case 'i':
                    result |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    break;
                case 'm':
                    result |= Pattern.MULTILINE;
                    break;
                case 's':
                    result |= Pattern.DOTALL;
                    break;
                case 'u':
                    result |= Pattern.UNICODE_CHARACTER_CLASS;
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported regex flag '" + flag + "'");
            }
        }
        return result;
    }

    /**
     * Converts {@code $&} and {@code $$} to their {@link Matcher} equivalents; {@code $1} is shared.
     */
    private static String toJavaReplacement(String replacement) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < replacement.length(); i++) {
            char c = replacement.charAt(i);
            if (c == '\\') {
                out.append("\\\\");
            } else if (c == '$' && i + 1 < replacement.length() && replacement.charAt(i + 1) == '&') {
                out.append("$0");
                i++;
            } else if (c == '$' && i + 1 < replacement.length() && replacement.charAt(i + 1) == '$') {
                out.append("\\$");
                i++;
            } else if (c == '$' && (i + 1 == replacement.length() || !Character.isDigit(replacement.charAt(i + 1)))) {
                out.append("\\$");
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private JsonNode split(JsonNode value, JsonNode cfg) {
        String separator = text(cfg, "separator", ",");
        String[] parts = JsValues.toJsString(value).split(Pattern.quote(separator), -1);
        JsonNode index = cfg.get("index");
        if (index != null && !index.isNull()) {
            double i = JsValues.toNumber(index);
            if (i == Math.rint(i) && i >= 0 && i < parts.length) {
                return TextNode.valueOf(parts[(int) i]);
            }
            return JsValues.undefined();
        }
        ArrayNode array = Json.NODES.arrayNode();
        for (String part : parts) {
            array.add(part);
        }
        return array;
    }

    private JsonNode numeric(JsonNode value, DoubleUnaryOperator operation) {
        double n = JsValues.toNumber(value);
        if (!Double.isFinite(n)) {
            return value;
        }
        double result = operation.applyAsDouble(n);
        return Double.isFinite(result) ? JsValues.numberNode(result) : value;
    }

    private JsonNode round(JsonNode value, JsonNode cfg) {
        int decimals = (int) Math.max(0, Math.min(MAX_ROUND_DECIMALS, finiteNumber(cfg, "decimals", 0)));
        double multiplier = Math.pow(10, decimals);
        return numeric(value, n -> roundHalfUp(n * multiplier) / multiplier);
    }

    private static double roundHalfUp(double n) {
        if (Math.abs(n) >= 4503599627370496d) {
            return n;
        }
        return Math.floor(n + 0.5);
    }

    private JsonNode divide(JsonNode value, JsonNode cfg) {
        JsonNode divisorNode = cfg.get("divisor");
        double divisor = divisorNode != null && divisorNode.isNumber() && Double.isFinite(divisorNode.doubleValue())
                ? divisorNode.doubleValue() : 1;
        if (divisor == 0) {
            logger.debug("divide kept the original value {}, divisor {}", value, divisorNode);
            return value;
        }
        double d = divisor;
        return numeric(value, n -> n / d);
    }

    private Optional<Instant> date(JsonNode value, String operation) {
        Optional<Instant> parsed = JsDates.parse(value, config.zone());
        if (parsed.isEmpty()) {
            logger.debug("{} received an invalid date: {}", operation, value);
        }
        return parsed;
    }

    private JsonNode shiftDays(JsonNode value, long days, String operation) {
        return date(value, operation)
                .flatMap(d -> JsDates.plusDays(d, days, config.zone()))
                .<JsonNode>map(d -> TextNode.valueOf(JsDates.toIsoString(d)))
                .orElse(value);
    }

    private static JsonNode toNumber(JsonNode value) {
        double n = JsValues.toNumber(value);
        return Double.isNaN(n) ? NullNode.getInstance() : JsValues.numberNode(n);
    }

    private static JsonNode toBoolean(JsonNode value) {
        if (value.isTextual()) {
            return BooleanNode.valueOf(TRUTHY_STRINGS.contains(value.textValue().toLowerCase(Locale.ROOT)));
        }
        return BooleanNode.valueOf(JsValues.truthy(value));
    }

    private static JsonNode parseJson(JsonNode value) {
        if (!value.isTextual()) {
            return value;
        }
        try {
            JsonNode parsed = Json.MAPPER.readTree(value.textValue());
            return parsed == null || parsed.isMissingNode() ? value : parsed;
        } catch (JsonProcessingException e) {
            logger.debug("parse_json kept the original string ({} chars): {}", value.textValue().length(), e.getOriginalMessage());
            return value;
        }
    }

    private static JsonNode stringifyJson(JsonNode value) {
        try {
            return TextNode.valueOf(Json.MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            logger.debug("stringify_json failed: {}", e.getOriginalMessage());
            return value;
        }
    }

    private JsonNode custom(JsonNode value, JsonNode cfg, TransformationContext context) {
        JsonNode expression = cfg.get("expression");
        if (expression == null || !expression.isTextual() || expression.textValue().isEmpty()) {
            return value;
        }
        return expressions.evaluate(expression.textValue(), context.expressionScope(value));
    }

    private static String text(JsonNode cfg, String field, String fallback) {
        JsonNode node = cfg.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        String text = JsValues.toJsString(node);
        return text.isEmpty() ? fallback : text;
    }

    private static double finiteNumber(JsonNode cfg, String field, double fallback) {
        JsonNode node = cfg.get(field);
        if (node != null && node.isNumber() && Double.isFinite(node.doubleValue())) {
            return node.doubleValue();
        }
        return fallback;
    }
}
