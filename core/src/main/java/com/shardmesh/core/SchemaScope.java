package com.shardmesh.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Visibility of a conversion schema: owned by one tenant, or shared by every tenant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchemaScope(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("tenantId") String tenantId
) {
    public enum Kind { TENANT, GLOBAL }

    public SchemaScope {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TENANT && (tenantId == null || tenantId.isBlank())) {
            throw new IllegalArgumentException("A tenant scope needs a tenantId");
        }
        if (kind == Kind.GLOBAL) {
            tenantId = null;
        }
    }

    public static SchemaScope tenant(String tenantId) {
        return new SchemaScope(Kind.TENANT, tenantId);
    }

    public static SchemaScope global() {
        return new SchemaScope(Kind.GLOBAL, null);
    }

    @JsonIgnore
    public boolean isGlobal() {
        return kind == Kind.GLOBAL;
    }
}
