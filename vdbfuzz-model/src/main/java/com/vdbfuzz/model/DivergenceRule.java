package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Comparison rule that produced an {@link Inconsistency}. */
public enum DivergenceRule {
    SUCCESS("success"),
    SEARCH_OVERLAP("search_overlap"),
    TOP_HIT("top_hit"),
    BATCH_SHAPE("batch_shape"),
    INSERT_COUNT("insert_count"),
    DELETE_COUNT("delete_count"),
    MIXED_STEP("mixed_step"),
    EXCLUSION("exclusion");

    private final String wireName;

    DivergenceRule(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static DivergenceRule fromWireName(String name) {
        for (DivergenceRule r : values()) {
            if (r.wireName.equalsIgnoreCase(name) || r.name().equalsIgnoreCase(name)) return r;
        }
        throw new IllegalArgumentException("Unknown divergence rule: " + name);
    }
}
