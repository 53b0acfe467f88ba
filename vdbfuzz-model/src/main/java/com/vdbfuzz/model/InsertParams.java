package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for insert and batch insert. {@code metadata} is positionally aligned with
 * {@code vectors}; entries may be null (no metadata for that vector).
 */
public final class InsertParams implements OperationParams {

    private final List<Vector> vectors;
    private final List<String> ids;
    private final List<Map<String, Object>> metadata;

    @JsonCreator
    public InsertParams(
            @JsonProperty("vectors") List<Vector> vectors,
            @JsonProperty("ids") List<String> ids,
            @JsonProperty("metadata") List<Map<String, Object>> metadata) {
        this.vectors = vectors != null ? List.copyOf(vectors) : List.of();
        this.ids = ids != null ? Collections.unmodifiableList(new ArrayList<>(ids)) : List.of();
        this.metadata = metadata != null ? Collections.unmodifiableList(new ArrayList<>(metadata)) : List.of();
    }

    public List<Vector> getVectors() {
        return vectors;
    }

    public List<String> getIds() {
        return ids;
    }

    public List<Map<String, Object>> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InsertParams that = (InsertParams) o;
        return vectors.equals(that.vectors) && ids.equals(that.ids) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectors, ids, metadata);
    }

    @Override
    public String toString() {
        return "InsertParams{vectors=" + vectors.size() + ", ids=" + ids.size() + "}";
    }
}
