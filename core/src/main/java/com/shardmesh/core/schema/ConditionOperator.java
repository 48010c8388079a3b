package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ConditionOperator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    IN("in"),
    NOT_IN("not_in"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null"),
    REGEX("regex");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConditionOperator fromWireName(String name) {
        return Arrays.stream(values())
                .filter(o -> o.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + name));
    }
}
