package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One {@link SearchData} per query, in query order. */
public final class BatchSearchData implements ResultData {

    private final List<SearchData> perQuery;

    @JsonCreator
    public BatchSearchData(@JsonProperty("perQuery") List<SearchData> perQuery) {
        this.perQuery = perQuery != null ? List.copyOf(perQuery) : List.of();
    }

    public List<SearchData> getPerQuery() {
        return perQuery;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return perQuery.equals(((BatchSearchData) o).perQuery);
    }

    @Override
    public int hashCode() {
        return perQuery.hashCode();
    }

    @Override
    public String toString() {
        return "BatchSearchData{queries=" + perQuery.size() + "}";
    }
}
