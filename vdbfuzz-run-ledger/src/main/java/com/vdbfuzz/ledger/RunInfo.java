package com.vdbfuzz.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a run was started with: services compared, services excluded at start, seed and adapter
 * versions (for audit and reproduction).
 */
public final class RunInfo {

    private final String runId;
    private final long startTimeMillis;
    private final List<String> services;
    private final List<String> excludedServices;
    private final Long seed;
    private final int plannedTests;
    private final Map<String, String> adapterVersions;

    @JsonCreator
    public RunInfo(
            @JsonProperty("runId") String runId,
            @JsonProperty("startTimeMillis") long startTimeMillis,
            @JsonProperty("services") List<String> services,
            @JsonProperty("excludedServices") List<String> excludedServices,
            @JsonProperty("seed") Long seed,
            @JsonProperty("plannedTests") int plannedTests,
            @JsonProperty("adapterVersions") Map<String, String> adapterVersions) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.startTimeMillis = startTimeMillis;
        this.services = services != null ? List.copyOf(services) : List.of();
        this.excludedServices = excludedServices != null ? List.copyOf(excludedServices) : List.of();
        this.seed = seed;
        this.plannedTests = plannedTests;
        this.adapterVersions = adapterVersions != null ? Map.copyOf(adapterVersions) : Map.of();
    }

    public String getRunId() {
        return runId;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    /** Services enabled for the run, in configuration order. */
    public List<String> getServices() {
        return services;
    }

    /** Services unhealthy at run start. */
    public List<String> getExcludedServices() {
        return excludedServices;
    }

    public Long getSeed() {
        return seed;
    }

    public int getPlannedTests() {
        return plannedTests;
    }

    public Map<String, String> getAdapterVersions() {
        return adapterVersions;
    }
}
