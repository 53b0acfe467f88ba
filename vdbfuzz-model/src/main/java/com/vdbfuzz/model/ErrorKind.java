package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Classification of a failed call. */
public enum ErrorKind {
    /** Network refusal, DNS or TLS failure, authentication rejected. */
    CONNECTION("connection"),
    /** Response did not match the expected shape. */
    PROTOCOL("protocol"),
    /** Call exceeded its deadline. */
    TIMEOUT("timeout"),
    /** Service answered with an error; its native payload is kept verbatim. */
    SERVICE("service"),
    /** Service cannot honour the requested metric for the collection. */
    UNSUPPORTED_METRIC("unsupported_metric"),
    /** Service was unhealthy at dispatch and recorded as failed instead of excluded. */
    UNHEALTHY("unhealthy"),
    /** Adapter raised something outside the taxonomy. */
    UNEXPECTED("unexpected");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ErrorKind fromWireName(String name) {
        for (ErrorKind k : values()) {
            if (k.wireName.equalsIgnoreCase(name) || k.name().equalsIgnoreCase(name)) return k;
        }
        throw new IllegalArgumentException("Unknown error kind: " + name);
    }
}
