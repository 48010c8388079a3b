package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Every transformation operator a schema may name. The wire name is the value stored in schema documents.
 */
public enum TransformationType {
    // string
    UPPERCASE("uppercase"),
    LOWERCASE("lowercase"),
    TRIM("trim"),
    TRUNCATE("truncate"),
    REPLACE("replace"),
    REGEX_REPLACE("regex_replace"),
    SPLIT("split"),
    CONCAT("concat"),

    // number
    ROUND("round"),
    FLOOR("floor"),
    CEIL("ceil"),
    MULTIPLY("multiply"),
    DIVIDE("divide"),
    ADD("add"),
    SUBTRACT("subtract"),
    ABS("abs"),
    CURRENCY_CONVERT("currency_convert"),

    // date
    PARSE_DATE("parse_date"),
    FORMAT_DATE("format_date"),
    ADD_DAYS("add_days"),
    SUBTRACT_DAYS("subtract_days"),
    TO_TIMESTAMP("to_timestamp"),
    TO_ISO_STRING("to_iso_string"),
    EXTRACT_YEAR("extract_year"),
    EXTRACT_MONTH("extract_month"),
    EXTRACT_DAY("extract_day"),

    // type coercion
    TO_STRING("to_string"),
    TO_NUMBER("to_number"),
    TO_BOOLEAN("to_boolean"),
    TO_ARRAY("to_array"),
    TO_DATE("to_date"),
    PARSE_JSON("parse_json"),
    STRINGIFY_JSON("stringify_json"),

    CUSTOM("custom");

    private final String wireName;

    TransformationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TransformationType fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transformation type: " + name));
    }
}
