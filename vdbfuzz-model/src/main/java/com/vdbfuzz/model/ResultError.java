package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structured error of a failed call. {@code body} is the service's native error payload exactly as
 * received (null when the failure happened before any response).
 */
@JsonPropertyOrder({"kind", "message", "statusCode", "body"})
public final class ResultError {

    private final ErrorKind kind;
    private final String message;
    private final Integer statusCode;
    private final String body;

    @JsonCreator
    public ResultError(
            @JsonProperty("kind") ErrorKind kind,
            @JsonProperty("message") String message,
            @JsonProperty("statusCode") Integer statusCode,
            @JsonProperty("body") String body) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message != null ? message : "";
        this.statusCode = statusCode;
        this.body = body;
    }

    public static ResultError of(ErrorKind kind, String message) {
        return new ResultError(kind, message, null, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultError that = (ResultError) o;
        return kind == that.kind && message.equals(that.message)
                && Objects.equals(statusCode, that.statusCode) && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, statusCode, body);
    }

    @Override
    public String toString() {
        return kind.getWireName() + (statusCode != null ? " " + statusCode : "") + ": " + message;
    }
}
