package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * Persisted record of one test case: the case, one result per dispatched service (in
 * configuration order), the services excluded as unhealthy, and the classified inconsistencies.
 * The JSON layout is versioned by {@link #SCHEMA_VERSION} so historical runs stay comparable.
 */
@JsonPropertyOrder({"schemaVersion", "testCase", "results", "excludedServices", "inconsistencies"})
@JsonIgnoreProperties(value = {"schemaVersion"}, allowGetters = true)
public final class TestResult {

    public static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TestCase testCase;
    private final List<DatabaseResult> results;
    private final List<String> excludedServices;
    private final List<Inconsistency> inconsistencies;

    @JsonCreator
    public TestResult(
            @JsonProperty("testCase") TestCase testCase,
            @JsonProperty("results") List<DatabaseResult> results,
            @JsonProperty("excludedServices") List<String> excludedServices,
            @JsonProperty("inconsistencies") List<Inconsistency> inconsistencies) {
        this.testCase = Objects.requireNonNull(testCase, "testCase");
        this.results = results != null ? List.copyOf(results) : List.of();
        this.excludedServices = excludedServices != null ? List.copyOf(excludedServices) : List.of();
        this.inconsistencies = inconsistencies != null ? List.copyOf(inconsistencies) : List.of();
    }

    public int getSchemaVersion() {
        return SCHEMA_VERSION;
    }

    public TestCase getTestCase() {
        return testCase;
    }

    public List<DatabaseResult> getResults() {
        return results;
    }

    public List<String> getExcludedServices() {
        return excludedServices;
    }

    public List<Inconsistency> getInconsistencies() {
        return inconsistencies;
    }

    /** Result for the given service, or null if it was not dispatched. */
    public DatabaseResult result(String service) {
        for (DatabaseResult r : results) {
            if (r.getService().equals(service)) return r;
        }
        return null;
    }

    public boolean hasInconsistencies() {
        return !inconsistencies.isEmpty();
    }

    /**
     * True when any compared services disagreed. Informational entries (a service excluded as
     * unhealthy) are kept in the record but do not make the case inconsistent.
     */
    public boolean hasDivergence() {
        for (Inconsistency i : inconsistencies) {
            if (i.getKind() != InconsistencyKind.INFORMATIONAL) return true;
        }
        return false;
    }

    /** Highest severity among the inconsistencies, or null when there are none. */
    public Severity maxSeverity() {
        Severity max = null;
        for (Inconsistency i : inconsistencies) {
            if (max == null || i.getSeverity().isAtLeast(max)) max = i.getSeverity();
        }
        return max;
    }

    /** Single-line JSON form, one record per line in result streams. */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize test result " + testCase.getId(), e);
        }
    }

    public static TestResult fromJson(String json) {
        try {
            return MAPPER.readValue(json, TestResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test result JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestResult that = (TestResult) o;
        return testCase.equals(that.testCase) && results.equals(that.results)
                && excludedServices.equals(that.excludedServices) && inconsistencies.equals(that.inconsistencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testCase, results, excludedServices, inconsistencies);
    }
}
