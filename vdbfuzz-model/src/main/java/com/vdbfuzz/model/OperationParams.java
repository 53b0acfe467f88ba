package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Operation-specific parameters of a {@link TestCase}. The persisted form carries a {@code type}
 * discriminator so records can be read back.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InsertParams.class, name = "insert"),
        @JsonSubTypes.Type(value = SearchParams.class, name = "search"),
        @JsonSubTypes.Type(value = DeleteParams.class, name = "delete"),
        @JsonSubTypes.Type(value = MixedParams.class, name = "mixed")
})
public interface OperationParams {
}
