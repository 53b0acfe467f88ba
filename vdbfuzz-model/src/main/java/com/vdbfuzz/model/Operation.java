package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operations a test case can exercise. The wire name is used in persisted records and in
 * configuration (e.g. operation weights).
 */
public enum Operation {
    INSERT("insert"),
    BATCH_INSERT("batch_insert"),
    SEARCH("search"),
    BATCH_SEARCH("batch_search"),
    DELETE("delete"),
    MIXED("mixed");

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Operations allowed as a step inside a {@link #MIXED} sequence. */
    public boolean isMixedStep() {
        return this == INSERT || this == SEARCH || this == DELETE;
    }

    /**
     * Resolves a wire name or enum constant name, case-insensitive. {@code mixed_operations} is
     * accepted as an alias of {@link #MIXED}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static Operation fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must be non-blank");
        }
        String n = name.trim();
        if ("mixed_operations".equalsIgnoreCase(n)) return MIXED;
        for (Operation op : values()) {
            if (op.wireName.equalsIgnoreCase(n) || op.name().equalsIgnoreCase(n)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + name);
    }
}
