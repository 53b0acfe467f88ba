package com.vdbfuzz.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** End-of-run totals handed to every sink. */
public final class RunSummary {

    private final String runId;
    private final RunStatus status;
    private final int testsRun;
    private final int testsWithInconsistencies;
    private final long startTimeMillis;
    private final long endTimeMillis;

    @JsonCreator
    public RunSummary(
            @JsonProperty("runId") String runId,
            @JsonProperty("status") RunStatus status,
            @JsonProperty("testsRun") int testsRun,
            @JsonProperty("testsWithInconsistencies") int testsWithInconsistencies,
            @JsonProperty("startTimeMillis") long startTimeMillis,
            @JsonProperty("endTimeMillis") long endTimeMillis) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.status = Objects.requireNonNull(status, "status");
        this.testsRun = testsRun;
        this.testsWithInconsistencies = testsWithInconsistencies;
        this.startTimeMillis = startTimeMillis;
        this.endTimeMillis = endTimeMillis;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getTestsRun() {
        return testsRun;
    }

    public int getTestsWithInconsistencies() {
        return testsWithInconsistencies;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    public long getEndTimeMillis() {
        return endTimeMillis;
    }

    public long getDurationMillis() {
        return Math.max(0, endTimeMillis - startTimeMillis);
    }

    @Override
    public String toString() {
        return "RunSummary{runId=" + runId + ", status=" + status + ", testsRun=" + testsRun
                + ", testsWithInconsistencies=" + testsWithInconsistencies + "}";
    }
}
