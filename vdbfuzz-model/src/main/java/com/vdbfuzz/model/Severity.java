package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Ordered severity; later constants are more severe. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
