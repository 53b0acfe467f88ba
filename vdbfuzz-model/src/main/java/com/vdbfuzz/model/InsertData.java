package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/** Ids the service reports as stored, in the order it reported them (duplicates preserved). */
public final class InsertData implements ResultData {

    private final List<String> storedIds;

    @JsonCreator
    public InsertData(@JsonProperty("storedIds") List<String> storedIds) {
        this.storedIds = storedIds != null ? Collections.unmodifiableList(new ArrayList<>(storedIds)) : List.of();
    }

    public List<String> getStoredIds() {
        return storedIds;
    }

    /** Number of distinct stored ids. */
    public int distinctCount() {
        return new LinkedHashSet<>(storedIds).size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return storedIds.equals(((InsertData) o).storedIds);
    }

    @Override
    public int hashCode() {
        return storedIds.hashCode();
    }

    @Override
    public String toString() {
        return "InsertData{stored=" + storedIds.size() + "}";
    }
}
