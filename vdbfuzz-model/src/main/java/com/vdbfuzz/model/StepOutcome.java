package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Outcome of one step of a mixed sequence on one service. Error is present iff the step failed. */
@JsonPropertyOrder({"index", "operation", "success", "data", "error"})
public final class StepOutcome {

    private final int index;
    private final Operation operation;
    private final boolean success;
    private final ResultData data;
    private final ResultError error;

    @JsonCreator
    public StepOutcome(
            @JsonProperty("index") int index,
            @JsonProperty("operation") Operation operation,
            @JsonProperty("success") boolean success,
            @JsonProperty("data") ResultData data,
            @JsonProperty("error") ResultError error) {
        if (success == (error != null)) {
            throw new IllegalArgumentException("error must be present iff the step failed");
        }
        this.index = index;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static StepOutcome success(int index, Operation operation, ResultData data) {
        return new StepOutcome(index, operation, true, data, null);
    }

    public static StepOutcome failure(int index, Operation operation, ResultError error) {
        return new StepOutcome(index, operation, false, null, error);
    }

    public int getIndex() {
        return index;
    }

    public Operation getOperation() {
        return operation;
    }

    public boolean isSuccess() {
        return success;
    }

    public ResultData getData() {
        return data;
    }

    public ResultError getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepOutcome that = (StepOutcome) o;
        return index == that.index && success == that.success && operation == that.operation
                && Objects.equals(data, that.data) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, operation, success, data, error);
    }
}
