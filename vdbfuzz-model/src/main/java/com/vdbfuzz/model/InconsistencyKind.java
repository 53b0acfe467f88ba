package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Classification of a cross-service disagreement. */
public enum InconsistencyKind {
    /** Some services succeeded and others failed on the same input. */
    ERROR_DIVERGENT("error-divergent", Severity.HIGH),
    /** All compared services succeeded but returned materially different data. */
    DIVERGENT("divergent", Severity.MEDIUM),
    /** Comparison ran with exactly one service excluded as unhealthy. */
    INFORMATIONAL("informational", Severity.LOW);

    private final String wireName;
    private final Severity severity;

    InconsistencyKind(String wireName, Severity severity) {
        this.wireName = wireName;
        this.severity = severity;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonCreator
    public static InconsistencyKind fromWireName(String name) {
        for (InconsistencyKind k : values()) {
            if (k.wireName.equalsIgnoreCase(name) || k.name().equalsIgnoreCase(name)) return k;
        }
        throw new IllegalArgumentException("Unknown inconsistency kind: " + name);
    }
}
