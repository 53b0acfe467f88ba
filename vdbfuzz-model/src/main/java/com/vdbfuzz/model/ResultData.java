package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Normalised payload of a successful call, shaped per operation so results from different
 * services can be compared directly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InsertData.class, name = "insert"),
        @JsonSubTypes.Type(value = SearchData.class, name = "search"),
        @JsonSubTypes.Type(value = BatchSearchData.class, name = "batch_search"),
        @JsonSubTypes.Type(value = DeleteData.class, name = "delete"),
        @JsonSubTypes.Type(value = MixedData.class, name = "mixed")
})
public interface ResultData {
}
