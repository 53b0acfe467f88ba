package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Similarity metric requested by a search. Adapters map it to the service's native name and fail
 * with an unsupported-metric error instead of substituting another metric.
 */
public enum Metric {
    L2("L2"),
    COSINE("cosine"),
    INNER_PRODUCT("inner_product");

    private final String wireName;

    Metric(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Resolves a wire name, enum name or the short alias {@code ip}. */
    @JsonCreator
    public static Metric fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name must be non-blank");
        }
        String n = name.trim();
        if ("ip".equalsIgnoreCase(n)) return INNER_PRODUCT;
        for (Metric m : values()) {
            if (m.wireName.equalsIgnoreCase(n) || m.name().equalsIgnoreCase(n)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + name);
    }
}
