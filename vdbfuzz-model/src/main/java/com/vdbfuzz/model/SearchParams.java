package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Parameters for search (one query) and batch search (several queries). */
public final class SearchParams implements OperationParams {

    private final List<Vector> queries;
    private final int k;
    private final Metric metric;

    @JsonCreator
    public SearchParams(
            @JsonProperty("queries") List<Vector> queries,
            @JsonProperty("k") int k,
            @JsonProperty("metric") Metric metric) {
        this.queries = queries != null ? List.copyOf(queries) : List.of();
        this.k = k;
        this.metric = metric != null ? metric : Metric.L2;
    }

    public List<Vector> getQueries() {
        return queries;
    }

    public int getK() {
        return k;
    }

    public Metric getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchParams that = (SearchParams) o;
        return k == that.k && queries.equals(that.queries) && metric == that.metric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(queries, k, metric);
    }

    @Override
    public String toString() {
        return "SearchParams{queries=" + queries.size() + ", k=" + k + ", metric=" + metric + "}";
    }
}
