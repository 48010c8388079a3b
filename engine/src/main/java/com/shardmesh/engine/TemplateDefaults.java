package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.HandlebarsException;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.cache.ConcurrentMapTemplateCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Renders {@code {{task.KEY}}} placeholders in default values with Handlebars. Unknown keys are left as
 * written.
 */
final class TemplateDefaults {
    private static final Logger logger = LoggerFactory.getLogger(TemplateDefaults.class);

    private static final Handlebars HANDLEBARS = handlebars();

    private TemplateDefaults() {
    }

    private static Handlebars handlebars() {
        Handlebars handlebars = new Handlebars()
                .with(EscapingStrategy.NOOP)
                .with(new ConcurrentMapTemplateCache());
        handlebars.registerHelper(Handlebars.HELPER_MISSING,
                (Helper<Object>) (context, options) -> "{{" + options.helperName + "}}");
        return handlebars;
    }

    static JsonNode resolve(JsonNode value, Map<String, String> taskConfig) {
        if (value == null) {
            return JsValues.undefined();
        }
        if (!value.isTextual() || !value.textValue().contains("{{")) {
            return value;
        }
        String text = value.textValue();
        try {
            return TextNode.valueOf(HANDLEBARS.compileInline(text).apply(Map.of("task", taskConfig)));
        } catch (IOException | HandlebarsException e) {
            logger.debug("Default '{}' kept as written: {}", text, e.getMessage());
            return value;
        }
    }
}
