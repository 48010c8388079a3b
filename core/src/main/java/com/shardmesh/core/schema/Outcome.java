package com.shardmesh.core.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a matching conditional rule produces: a static value, a copied field, or a field run through a chain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Outcome(
        @JsonProperty("type") OutcomeKind type,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("sourceField") String sourceField,
        @JsonProperty("transformations") List<Transformation> transformations
) {
    public Outcome {
        transformations = transformations == null ? List.of() : List.copyOf(transformations);
    }

    public static Outcome value(JsonNode value) {
        return new Outcome(OutcomeKind.VALUE, value, null, null);
    }

    public static Outcome field(String sourceField) {
        return new Outcome(OutcomeKind.FIELD, null, sourceField, null);
    }

    public static Outcome transform(String sourceField, List<Transformation> transformations) {
        return new Outcome(OutcomeKind.TRANSFORM, null, sourceField, transformations);
    }
}
