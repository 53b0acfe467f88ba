package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Outcome of one test case on one service. Immutable; {@code error} is present iff
 * {@code success} is false.
 */
@JsonPropertyOrder({"service", "success", "data", "error", "executionTimeNanos"})
public final class DatabaseResult {

    private final String service;
    private final boolean success;
    private final ResultData data;
    private final ResultError error;
    private final long executionTimeNanos;

    @JsonCreator
    public DatabaseResult(
            @JsonProperty("service") String service,
            @JsonProperty("success") boolean success,
            @JsonProperty("data") ResultData data,
            @JsonProperty("error") ResultError error,
            @JsonProperty("executionTimeNanos") long executionTimeNanos) {
        this.service = Objects.requireNonNull(service, "service");
        if (success == (error != null)) {
            throw new IllegalArgumentException("error must be present iff success is false (service=" + service + ")");
        }
        this.success = success;
        this.data = data;
        this.error = error;
        this.executionTimeNanos = Math.max(0L, executionTimeNanos);
    }

    public static DatabaseResult success(String service, ResultData data, long executionTimeNanos) {
        return new DatabaseResult(service, true, data, null, executionTimeNanos);
    }

    public static DatabaseResult failure(String service, ResultError error, long executionTimeNanos) {
        return new DatabaseResult(service, false, null, Objects.requireNonNull(error, "error"), executionTimeNanos);
    }

    public String getService() {
        return service;
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

    public long getExecutionTimeNanos() {
        return executionTimeNanos;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatabaseResult that = (DatabaseResult) o;
        return success == that.success && executionTimeNanos == that.executionTimeNanos
                && service.equals(that.service) && Objects.equals(data, that.data) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, success, data, error, executionTimeNanos);
    }

    @Override
    public String toString() {
        return "DatabaseResult{service=" + service + ", success=" + success
                + (success ? ", data=" + data : ", error=" + error) + "}";
    }
}
