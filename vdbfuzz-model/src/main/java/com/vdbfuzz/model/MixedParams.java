package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Ordered steps of a mixed sequence; all steps target the test case's collection. */
public final class MixedParams implements OperationParams {

    private final List<MixedStep> steps;

    @JsonCreator
    public MixedParams(@JsonProperty("steps") List<MixedStep> steps) {
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public List<MixedStep> getSteps() {
        return steps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return steps.equals(((MixedParams) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "MixedParams{steps=" + steps.size() + "}";
    }
}
