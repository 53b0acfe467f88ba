package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Number of entries the service reports as removed. */
public final class DeleteData implements ResultData {

    private final long removed;

    @JsonCreator
    public DeleteData(@JsonProperty("removed") long removed) {
        this.removed = removed;
    }

    public long getRemoved() {
        return removed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return removed == ((DeleteData) o).removed;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(removed);
    }

    @Override
    public String toString() {
        return "DeleteData{removed=" + removed + "}";
    }
}
