package com.vdbfuzz.ledger;

import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.Inconsistency;
import com.vdbfuzz.model.InconsistencyKind;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.TestResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates a run into totals and a plain-text report: consistency rate, per-service success,
 * per-operation and per-kind counts, and the first inconsistencies found.
 * <p>
 * Per-service success is counted only over results that were actually dispatched; results recorded
 * as failed because the service was unhealthy are left out.
 */
public final class RunStatistics implements ResultSink {

    static final int TOP_INCONSISTENCIES = 10;

    private final Map<String, int[]> services = new LinkedHashMap<>();
    private final Map<Operation, int[]> operations = new EnumMap<>(Operation.class);
    private final Map<InconsistencyKind, Integer> kinds = new EnumMap<>(InconsistencyKind.class);
    private final List<String> top = new ArrayList<>();
    private int total;
    private int inconsistent;
    private RunSummary summary;

    @Override
    public synchronized void runStarted(RunInfo run) {
        for (String s : run.getServices()) services.putIfAbsent(s, new int[2]);
    }

    @Override
    public synchronized void testCompleted(TestResult result) {
        total++;
        Operation op = result.getTestCase().getOperation();
        int[] opCounts = operations.computeIfAbsent(op, k -> new int[2]);
        opCounts[0]++;
        if (result.hasDivergence()) {
            inconsistent++;
            opCounts[1]++;
        }
        for (DatabaseResult r : result.getResults()) {
            if (!r.isSuccess() && r.getError().getKind() == ErrorKind.UNHEALTHY) continue;
            int[] s = services.computeIfAbsent(r.getService(), k -> new int[2]);
            s[1]++;
            if (r.isSuccess()) s[0]++;
        }
        for (Inconsistency i : result.getInconsistencies()) {
            kinds.merge(i.getKind(), 1, Integer::sum);
            if (top.size() < TOP_INCONSISTENCIES) {
                top.add(result.getTestCase().getId() + " (" + op.getWireName() + "): [" + i.getKind().getWireName()
                        + "/" + i.getRule() + "] " + i.getDescription());
            }
        }
    }

    @Override
    public synchronized void runEnded(RunSummary summary) {
        this.summary = summary;
    }

    public synchronized int getTotalTests() {
        return total;
    }

    public synchronized int getTestsWithInconsistencies() {
        return inconsistent;
    }

    /** Percentage of tests where the compared services agreed; 0 when no test ran. */
    public synchronized double getConsistencyRate() {
        return total == 0 ? 0.0 : (total - inconsistent) * 100.0 / total;
    }

    /** service → {successes, dispatched} */
    public synchronized Map<String, int[]> getServiceCounts() {
        Map<String, int[]> copy = new LinkedHashMap<>();
        services.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    /** operation → {tests, tests with inconsistencies} */
    public synchronized Map<Operation, int[]> getOperationCounts() {
        Map<Operation, int[]> copy = new EnumMap<>(Operation.class);
        operations.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    public synchronized Map<InconsistencyKind, Integer> getKindCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(kinds));
    }

    public synchronized List<String> getTopInconsistencies() {
        return List.copyOf(top);
    }

    public synchronized String report() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Vector Database Differential Fuzzing Report ===\n\n");
        if (summary != null) {
            sb.append("Run: ").append(summary.getRunId()).append(" (").append(summary.getStatus()).append(", ")
                    .append(summary.getDurationMillis()).append(" ms)\n\n");
        }
        sb.append("Summary:\n");
        sb.append("- Total Tests: ").append(total).append('\n');
        sb.append("- Inconsistencies Found: ").append(inconsistent).append('\n');
        sb.append("- Consistency Rate: ").append(pct(getConsistencyRate())).append("%\n");

        sb.append("\nDatabase Success Rates:\n");
        services.forEach((name, c) -> sb.append("- ").append(name).append(": ").append(c[0]).append('/').append(c[1])
                .append(" (").append(pct(c[1] == 0 ? 0.0 : c[0] * 100.0 / c[1])).append("% success)\n"));

        sb.append("\nOperation Statistics:\n");
        operations.forEach((op, c) -> sb.append("- ").append(op.getWireName()).append(": ").append(c[0])
                .append(" tests, ").append(c[1]).append(" inconsistencies (")
                .append(pct(c[0] == 0 ? 0.0 : (c[0] - c[1]) * 100.0 / c[0])).append("% consistency)\n"));

        if (!kinds.isEmpty()) {
            sb.append("\nInconsistencies by Kind:\n");
            kinds.forEach((k, n) -> sb.append("- ").append(k.getWireName()).append(" (").append(k.getSeverity().getWireName())
                    .append("): ").append(n).append('\n'));
        }
        if (!top.isEmpty()) {
            sb.append("\nTop Inconsistencies:\n");
            for (int i = 0; i < top.size(); i++) {
                sb.append(i + 1).append(". ").append(top.get(i)).append('\n');
            }
        }
        return sb.toString();
    }

    public void writeReport(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, report(), StandardCharsets.UTF_8);
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
