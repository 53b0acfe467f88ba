package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One step of a mixed sequence: an insert, search or delete with its own parameters. */
public final class MixedStep {

    private final Operation operation;
    private final OperationParams params;

    @JsonCreator
    public MixedStep(
            @JsonProperty("operation") Operation operation,
            @JsonProperty("params") OperationParams params) {
        this.operation = Objects.requireNonNull(operation, "operation");
        if (!operation.isMixedStep()) {
            throw new IllegalArgumentException("Not allowed as a mixed step: " + operation.getWireName());
        }
        this.params = Objects.requireNonNull(params, "params");
    }

    public Operation getOperation() {
        return operation;
    }

    public OperationParams getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MixedStep that = (MixedStep) o;
        return operation == that.operation && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, params);
    }
}
