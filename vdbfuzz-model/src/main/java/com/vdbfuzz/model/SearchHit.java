package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One ranked search result: the caller-side id and the service's native score or distance. */
public final class SearchHit {

    private final String id;
    private final double score;

    @JsonCreator
    public SearchHit(@JsonProperty("id") String id, @JsonProperty("score") double score) {
        this.id = id;
        this.score = score;
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchHit that = (SearchHit) o;
        return Double.compare(score, that.score) == 0 && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, score);
    }

    @Override
    public String toString() {
        return id + "@" + score;
    }
}
