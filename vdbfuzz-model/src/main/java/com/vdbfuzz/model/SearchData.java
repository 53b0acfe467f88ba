package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Ranked hits for a single query, best first. */
public final class SearchData implements ResultData {

    private final List<SearchHit> hits;

    @JsonCreator
    public SearchData(@JsonProperty("hits") List<SearchHit> hits) {
        this.hits = hits != null ? List.copyOf(hits) : List.of();
    }

    public List<SearchHit> getHits() {
        return hits;
    }

    public Set<String> idSet() {
        Set<String> ids = new LinkedHashSet<>();
        for (SearchHit h : hits) ids.add(h.getId());
        return ids;
    }

    /** Id of the best hit, or null when there are no hits. */
    public String topId() {
        return hits.isEmpty() ? null : hits.get(0).getId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hits.equals(((SearchData) o).hits);
    }

    @Override
    public int hashCode() {
        return hits.hashCode();
    }

    @Override
    public String toString() {
        return "SearchData{hits=" + hits + "}";
    }
}
