package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.FuzzSettings;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.ledger.ResultSink;
import com.vdbfuzz.ledger.RunInfo;
import com.vdbfuzz.ledger.RunStatistics;
import com.vdbfuzz.ledger.RunStatus;
import com.vdbfuzz.ledger.RunSummary;
import com.vdbfuzz.model.DeleteData;
import com.vdbfuzz.model.DeleteParams;
import com.vdbfuzz.model.InconsistencyKind;
import com.vdbfuzz.model.InsertParams;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.SearchData;
import com.vdbfuzz.model.SearchParams;
import com.vdbfuzz.model.TestCase;
import com.vdbfuzz.model.TestResult;
import com.vdbfuzz.model.Vector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FuzzRunnerTest {

    private static class CapturingSink implements ResultSink {
        final List<RunInfo> started = new ArrayList<>();
        final List<TestResult> results = new ArrayList<>();
        final List<RunSummary> ended = new ArrayList<>();

        @Override
        public void runStarted(RunInfo run) {
            started.add(run);
        }

        @Override
        public void testCompleted(TestResult result) {
            results.add(result);
        }

        @Override
        public void runEnded(RunSummary summary) {
            ended.add(summary);
        }
    }

    private static FuzzerConfig config(int tests, int batchSize) {
        return FuzzerConfig.builder()
                .testCount(tests)
                .batchSize(batchSize)
                .callTimeoutMillis(5_000)
                .fuzzSettings(FuzzSettings.builder().vectorDimension(4).seed(11L).build())
                .build();
    }

    private static FuzzRunner prepared(List<ServiceAdapter> adapters, CapturingSink sink) throws Exception {
        FuzzRunner runner = new FuzzRunner(config(1, 1), adapters, sink);
        runner.getHealthMonitor().probeAll();
        for (ServiceAdapter a : adapters) a.ensureCollection(a.defaultCollection(), 4);
        return runner;
    }

    private static TestCase insert(long id, List<Vector> vectors, List<String> ids) {
        return new TestCase(id, Operation.INSERT, null, new InsertParams(vectors, ids, List.of()));
    }

    @Test
    void searchNearStoredVector_allAgreeOnTopHit() throws Exception {
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus"),
                new InMemoryServiceAdapter("qdrant"), new InMemoryServiceAdapter("chroma"));
        try (FuzzRunner runner = prepared(adapters, new CapturingSink())) {
            HealthSnapshot snapshot = runner.getHealthMonitor().current();
            runner.execute(insert(1, List.of(Vector.of(1, 0, 0, 0), Vector.of(0, 1, 0, 0), Vector.of(0, 0, 1, 0)),
                    List.of("a", "b", "c")), snapshot);

            TestCase search = new TestCase(2, Operation.SEARCH, null,
                    new SearchParams(List.of(Vector.of(0.9f, 0.1f, 0, 0)), 2, Metric.L2));
            TestResult result = runner.execute(search, snapshot);

            assertFalse(result.hasInconsistencies());
            for (String s : List.of("milvus", "qdrant", "chroma")) {
                assertEquals("a", ((SearchData) result.result(s).getData()).topId());
            }
        }
    }

    @Test
    void nanInsertRejectedByOneService_exactlyOneErrorDivergent() throws Exception {
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus"),
                new InMemoryServiceAdapter("qdrant").rejectingNonFinite(), new InMemoryServiceAdapter("chroma"));
        try (FuzzRunner runner = prepared(adapters, new CapturingSink())) {
            TestResult result = runner.execute(insert(1, List.of(Vector.of(Float.NaN, 0, 0, 0)), List.of("n")),
                    runner.getHealthMonitor().current());

            assertEquals(1, result.getInconsistencies().size());
            assertEquals(InconsistencyKind.ERROR_DIVERGENT, result.getInconsistencies().get(0).getKind());
            assertFalse(result.result("qdrant").isSuccess());
        }
    }

    @Test
    void deleteNonexistentId_noInconsistency() throws Exception {
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus"), new InMemoryServiceAdapter("qdrant"));
        try (FuzzRunner runner = prepared(adapters, new CapturingSink())) {
            TestResult result = runner.execute(new TestCase(1, Operation.DELETE, null,
                    new DeleteParams(List.of("nonexistent"))), runner.getHealthMonitor().current());
            assertFalse(result.hasInconsistencies());
            assertEquals(new DeleteData(0), result.result("milvus").getData());
        }
    }

    @Test
    void oneServiceExcluded_agreementStillCountsAsConsistent() throws Exception {
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus"),
                new InMemoryServiceAdapter("qdrant"), new InMemoryServiceAdapter("chroma").unreachable());
        RunStatistics stats = new RunStatistics();
        try (FuzzRunner runner = new FuzzRunner(config(1, 1), adapters, new CapturingSink())) {
            HealthSnapshot snapshot = runner.getHealthMonitor().probeAll();
            for (ServiceAdapter a : adapters) {
                if (snapshot.isHealthy(a.getServiceName())) a.ensureCollection(a.defaultCollection(), 4);
            }
            TestResult result = runner.execute(new TestCase(1, Operation.DELETE, null,
                    new DeleteParams(List.of("nonexistent"))), snapshot);
            stats.testCompleted(result);

            assertEquals(List.of("chroma"), result.getExcludedServices());
            assertEquals(InconsistencyKind.INFORMATIONAL, result.getInconsistencies().get(0).getKind());
            assertFalse(result.hasDivergence());
            assertEquals(0, stats.getTestsWithInconsistencies());
            assertEquals(100.0, stats.getConsistencyRate(), 1e-9);
        }
    }

    @Test
    void deleteTwice_removesThenZero() throws Exception {
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus"), new InMemoryServiceAdapter("qdrant"));
        try (FuzzRunner runner = prepared(adapters, new CapturingSink())) {
            HealthSnapshot snapshot = runner.getHealthMonitor().current();
            runner.execute(insert(1, List.of(Vector.of(1, 2, 3, 4)), List.of("d")), snapshot);
            TestCase delete = new TestCase(2, Operation.DELETE, null, new DeleteParams(List.of("d")));

            TestResult first = runner.execute(delete, snapshot);
            TestResult second = runner.execute(delete, snapshot);
            assertTrue(((DeleteData) first.result("milvus").getData()).getRemoved() > 0);
            assertEquals(0, ((DeleteData) second.result("milvus").getData()).getRemoved());
            assertEquals(0, ((DeleteData) second.result("qdrant").getData()).getRemoved());
        }
    }

    @Test
    void run_emitsEveryResultInGenerationOrder() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        CapturingSink sink = new CapturingSink();
        try (FuzzRunner runner = new FuzzRunner(config(7, 3), List.of(milvus, qdrant), sink)) {
            RunSummary summary = runner.run();

            assertEquals(RunStatus.COMPLETED, summary.getStatus());
            assertEquals(7, summary.getTestsRun());
            assertEquals(1, sink.started.size());
            assertEquals(List.of("milvus", "qdrant"), sink.started.get(0).getServices());
            assertEquals(7, sink.results.size());
            for (int i = 0; i < 7; i++) {
                assertEquals(i + 1, sink.results.get(i).getTestCase().getId());
            }
            assertEquals(List.of(summary), sink.ended);
        }
    }

    @Test
    void run_noReachableService_aborts() {
        CapturingSink sink = new CapturingSink();
        List<ServiceAdapter> adapters = List.of(new InMemoryServiceAdapter("milvus").unreachable(),
                new InMemoryServiceAdapter("qdrant").unreachable());
        try (FuzzRunner runner = new FuzzRunner(config(5, 2), adapters, sink)) {
            RunSummary summary = runner.run();
            assertEquals(RunStatus.ABORTED_NO_REACHABLE_SERVICES, summary.getStatus());
            assertEquals(0, summary.getTestsRun());
            assertTrue(sink.results.isEmpty());
            assertEquals(List.of("milvus", "qdrant"), sink.started.get(0).getExcludedServices());
            assertEquals(1, sink.ended.size());
        }
    }

    @Test
    void run_serviceLostMidRun_excludedFromLaterBatches() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        InMemoryServiceAdapter chroma = new InMemoryServiceAdapter("chroma");
        CapturingSink sink = new CapturingSink() {
            @Override
            public void testCompleted(TestResult result) {
                super.testCompleted(result);
                if (results.size() == 1) chroma.reachable = false;
            }
        };
        try (FuzzRunner runner = new FuzzRunner(config(4, 2), List.of(milvus, qdrant, chroma), sink)) {
            RunSummary summary = runner.run();
            assertEquals(4, summary.getTestsRun());
            TestResult last = sink.results.get(3);
            assertEquals(List.of("chroma"), last.getExcludedServices());
            assertNull(last.result("chroma"));
            assertTrue(last.getInconsistencies().stream()
                    .anyMatch(i -> i.getKind() == InconsistencyKind.INFORMATIONAL));
        }
    }
}
