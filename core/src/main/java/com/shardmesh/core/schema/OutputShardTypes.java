package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OutputShardTypes(
        @JsonProperty("primary") String primary,
        @JsonProperty("derived") List<DerivedDescriptor> derived
) {
    public OutputShardTypes {
        derived = derived == null ? List.of() : List.copyOf(derived);
    }
}
