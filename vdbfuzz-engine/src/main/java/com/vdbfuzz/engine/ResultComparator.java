package com.vdbfuzz.engine;

import com.vdbfuzz.config.ComparisonPolicy;
import com.vdbfuzz.model.BatchSearchData;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.DeleteData;
import com.vdbfuzz.model.DivergenceRule;
import com.vdbfuzz.model.Inconsistency;
import com.vdbfuzz.model.InconsistencyKind;
import com.vdbfuzz.model.InsertData;
import com.vdbfuzz.model.MixedData;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.ResultData;
import com.vdbfuzz.model.SearchData;
import com.vdbfuzz.model.StepOutcome;
import com.vdbfuzz.model.TestCase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Compares the full set of per-service results for one test case and lists every disagreement.
 * Stateless; called exactly once per test case after all invocations have settled.
 */
public final class ResultComparator {

    private static final String NO_HIT = "<none>";

    private final ComparisonPolicy policy;

    public ResultComparator(ComparisonPolicy policy) {
        this.policy = policy != null ? policy : ComparisonPolicy.defaults();
    }

    public ComparisonPolicy getPolicy() {
        return policy;
    }

    /**
     * Jaccard index of two id sets; two empty sets are identical (1.0).
     */
    public static double overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> inter = new HashSet<>(a);
        inter.retainAll(b);
        return (double) inter.size() / union.size();
    }

    /**
     * @param results  results of every dispatched service
     * @param excluded services left out because they were unhealthy
     */
    public List<Inconsistency> compare(TestCase testCase, List<DatabaseResult> results, List<String> excluded) {
        Objects.requireNonNull(testCase, "testCase");
        List<Inconsistency> out = new ArrayList<>();
        if (results == null || results.size() < 2) {
            return out;
        }
        List<DatabaseResult> ok = new ArrayList<>();
        List<DatabaseResult> failed = new ArrayList<>();
        for (DatabaseResult r : results) {
            (r.isSuccess() ? ok : failed).add(r);
        }
        if (!ok.isEmpty() && !failed.isEmpty()) {
            out.add(new Inconsistency(InconsistencyKind.ERROR_DIVERGENT, DivergenceRule.SUCCESS,
                    names(results), "succeeded: " + names(ok) + "; failed: " + describeFailures(failed)));
        }
        if (ok.size() >= 2) {
            Map<String, ResultData> data = new LinkedHashMap<>();
            ok.forEach(r -> data.put(r.getService(), r.getData()));
            compareData(testCase.getOperation(), data, "", out);
        }
        if (excluded != null && excluded.size() == 1) {
            out.add(new Inconsistency(InconsistencyKind.INFORMATIONAL, DivergenceRule.EXCLUSION,
                    List.of(excluded.get(0)), "compared without " + excluded.get(0) + " (unhealthy)"));
        }
        return out;
    }

    private void compareData(Operation operation, Map<String, ResultData> data, String prefix,
                             List<Inconsistency> out) {
        switch (operation) {
            case INSERT, BATCH_INSERT -> compareCounts(data, DivergenceRule.INSERT_COUNT, prefix,
                    d -> (long) ((InsertData) d).distinctCount(), "stored ids", out);
            case DELETE -> compareCounts(data, DivergenceRule.DELETE_COUNT, prefix,
                    d -> ((DeleteData) d).getRemoved(), "removed", out);
            case SEARCH -> {
                Map<String, SearchData> lists = new LinkedHashMap<>();
                data.forEach((s, d) -> lists.put(s, (SearchData) d));
                compareSearch(lists, prefix, out);
            }
            case BATCH_SEARCH -> compareBatchSearch(data, prefix, out);
            case MIXED -> compareMixed(data, out);
        }
    }

    private void compareCounts(Map<String, ResultData> data, DivergenceRule rule, String prefix,
                               ToLongFunction<ResultData> count, String what,
                               List<Inconsistency> out) {
        Map<String, Long> counts = new LinkedHashMap<>();
        data.forEach((s, d) -> counts.put(s, count.applyAsLong(d)));
        if (new HashSet<>(counts.values()).size() > 1) {
            out.add(new Inconsistency(InconsistencyKind.DIVERGENT, rule, List.copyOf(counts.keySet()),
                    prefix + what + " differ: " + counts));
        }
    }

    private void compareSearch(Map<String, SearchData> lists, String prefix, List<Inconsistency> out) {
        List<String> services = List.copyOf(lists.keySet());
        double threshold = policy.getSearchOverlapThreshold();
        Set<String> involved = new LinkedHashSet<>();
        List<String> pairs = new ArrayList<>();
        for (int i = 0; i < services.size(); i++) {
            for (int j = i + 1; j < services.size(); j++) {
                String a = services.get(i);
                String b = services.get(j);
                double o = overlap(lists.get(a).idSet(), lists.get(b).idSet());
                if (o < threshold) {
                    involved.add(a);
                    involved.add(b);
                    pairs.add(a + "/" + b + "=" + String.format(Locale.ROOT, "%.2f", o));
                }
            }
        }
        if (!pairs.isEmpty()) {
            out.add(new Inconsistency(InconsistencyKind.DIVERGENT, DivergenceRule.SEARCH_OVERLAP,
                    List.copyOf(involved), prefix + "result overlap below "
                    + String.format(Locale.ROOT, "%.2f", threshold) + ": " + String.join(", ", pairs)));
        }
        if (policy.isCompareTopHit()) {
            Map<String, String> tops = new LinkedHashMap<>();
            lists.forEach((s, d) -> tops.put(s, d.topId() != null ? d.topId() : NO_HIT));
            if (new HashSet<>(tops.values()).size() > 1) {
                out.add(new Inconsistency(InconsistencyKind.DIVERGENT, DivergenceRule.TOP_HIT,
                        services, prefix + "top hits differ: " + tops));
            }
        }
    }

    private void compareBatchSearch(Map<String, ResultData> data, String prefix, List<Inconsistency> out) {
        Map<String, List<SearchData>> perService = new LinkedHashMap<>();
        data.forEach((s, d) -> perService.put(s, ((BatchSearchData) d).getPerQuery()));
        Map<String, Integer> shapes = new LinkedHashMap<>();
        perService.forEach((s, l) -> shapes.put(s, l.size()));
        if (new HashSet<>(shapes.values()).size() > 1) {
            out.add(new Inconsistency(InconsistencyKind.DIVERGENT, DivergenceRule.BATCH_SHAPE,
                    List.copyOf(shapes.keySet()), prefix + "answered query counts differ: " + shapes));
        }
        int common = shapes.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        for (int q = 0; q < common; q++) {
            Map<String, SearchData> lists = new LinkedHashMap<>();
            final int index = q;
            perService.forEach((s, l) -> lists.put(s, l.get(index)));
            compareSearch(lists, prefix + "query " + q + ": ", out);
        }
    }

    private void compareMixed(Map<String, ResultData> data, List<Inconsistency> out) {
        Map<String, List<StepOutcome>> perService = new LinkedHashMap<>();
        data.forEach((s, d) -> perService.put(s, ((MixedData) d).getSteps()));
        int steps = perService.values().stream().mapToInt(List::size).max().orElse(0);
        for (int i = 0; i < steps; i++) {
            String prefix = "step " + i + ": ";
            Map<String, StepOutcome> at = new LinkedHashMap<>();
            for (Map.Entry<String, List<StepOutcome>> e : perService.entrySet()) {
                if (i < e.getValue().size()) at.put(e.getKey(), e.getValue().get(i));
            }
            List<String> ok = at.entrySet().stream().filter(e -> e.getValue().isSuccess())
                    .map(Map.Entry::getKey).collect(Collectors.toList());
            List<String> failed = at.entrySet().stream().filter(e -> !e.getValue().isSuccess())
                    .map(e -> e.getKey() + " (" + e.getValue().getError().getKind().getWireName() + ")")
                    .collect(Collectors.toList());
            // a sequence cut short by its deadline has no outcome for the remaining steps
            List<String> missing = new ArrayList<>(perService.keySet());
            missing.removeAll(at.keySet());
            missing.forEach(s -> failed.add(s + " (not run)"));
            if (!ok.isEmpty() && !failed.isEmpty()) {
                out.add(new Inconsistency(InconsistencyKind.ERROR_DIVERGENT, DivergenceRule.MIXED_STEP,
                        List.copyOf(perService.keySet()), prefix + "succeeded: " + ok + "; failed: " + failed));
            }
            if (ok.size() >= 2) {
                Map<String, ResultData> stepData = new LinkedHashMap<>();
                ok.forEach(s -> stepData.put(s, at.get(s).getData()));
                compareData(at.get(ok.get(0)).getOperation(), stepData, prefix, out);
            }
        }
    }

    private static List<String> names(List<DatabaseResult> results) {
        return results.stream().map(DatabaseResult::getService).collect(Collectors.toList());
    }

    private static String describeFailures(List<DatabaseResult> failed) {
        return failed.stream()
                .map(r -> r.getService() + " (" + r.getError().getKind().getWireName() + ": " + r.getError().getMessage() + ")")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
