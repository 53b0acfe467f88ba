package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Immutable ordered sequence of float components. NaN, infinities, empty and oversized vectors are
 * legal values; nothing here validates them.
 */
public final class Vector {

    private final float[] components;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Vector(float[] components) {
        this.components = components != null ? components.clone() : new float[0];
    }

    public static Vector of(float... components) {
        return new Vector(components);
    }

    public int dimension() {
        return components.length;
    }

    public boolean isEmpty() {
        return components.length == 0;
    }

    public float get(int index) {
        return components[index];
    }

    /** Copy of the components. */
    @JsonValue
    public float[] toArray() {
        return components.clone();
    }

    /** True when any component is NaN or infinite. */
    public boolean hasNonFinite() {
        for (float c : components) {
            if (!Float.isFinite(c)) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(components, ((Vector) o).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return "Vector{dimension=" + components.length + (hasNonFinite() ? ", nonFinite" : "") + "}";
    }
}
