package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One generated operation, issued identically to every healthy service.
 * <p>
 * {@code collection} is null when each service should use its own configured collection; a
 * non-null value is an explicit override (e.g. a nonexistent or malformed collection name) sent
 * verbatim to every service.
 */
@JsonPropertyOrder({"id", "operation", "collection", "params"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class TestCase {

    private final long id;
    private final Operation operation;
    private final String collection;
    private final OperationParams params;

    @JsonCreator
    public TestCase(
            @JsonProperty("id") long id,
            @JsonProperty("operation") Operation operation,
            @JsonProperty("collection") String collection,
            @JsonProperty("params") OperationParams params) {
        this.id = id;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.collection = collection;
        this.params = Objects.requireNonNull(params, "params");
        checkParams(operation, params);
    }

    private static void checkParams(Operation operation, OperationParams params) {
        boolean ok = switch (operation) {
            case INSERT, BATCH_INSERT -> params instanceof InsertParams;
            case SEARCH, BATCH_SEARCH -> params instanceof SearchParams;
            case DELETE -> params instanceof DeleteParams;
            case MIXED -> params instanceof MixedParams;
        };
        if (!ok) {
            throw new IllegalArgumentException("Parameters " + params.getClass().getSimpleName()
                    + " do not match operation " + operation.getWireName());
        }
    }

    public long getId() {
        return id;
    }

    public Operation getOperation() {
        return operation;
    }

    /** Collection override, or null for each service's configured collection. */
    public String getCollection() {
        return collection;
    }

    public OperationParams getParams() {
        return params;
    }

    /** Returns the override if present, else the given service default. */
    public String collectionOr(String serviceDefault) {
        return collection != null ? collection : serviceDefault;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestCase that = (TestCase) o;
        return id == that.id && operation == that.operation
                && Objects.equals(collection, that.collection) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operation, collection, params);
    }

    @Override
    public String toString() {
        return "TestCase{id=" + id + ", operation=" + operation.getWireName()
                + (collection != null ? ", collection='" + collection + "'" : "") + ", params=" + params + "}";
    }
}
