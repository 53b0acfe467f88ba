package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Per-step outcomes of a mixed sequence, in step order. */
public final class MixedData implements ResultData {

    private final List<StepOutcome> steps;

    @JsonCreator
    public MixedData(@JsonProperty("steps") List<StepOutcome> steps) {
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public List<StepOutcome> getSteps() {
        return steps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return steps.equals(((MixedData) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }
}
