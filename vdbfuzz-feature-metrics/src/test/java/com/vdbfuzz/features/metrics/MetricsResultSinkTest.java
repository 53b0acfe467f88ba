package com.vdbfuzz.features.metrics;

import com.vdbfuzz.ledger.RunInfo;
import com.vdbfuzz.ledger.RunStatus;
import com.vdbfuzz.ledger.RunSummary;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.DivergenceRule;
import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.Inconsistency;
import com.vdbfuzz.model.InconsistencyKind;
import com.vdbfuzz.model.InsertData;
import com.vdbfuzz.model.InsertParams;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.ResultError;
import com.vdbfuzz.model.TestCase;
import com.vdbfuzz.model.TestResult;
import com.vdbfuzz.model.Vector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsResultSinkTest {

    private static TestResult nanInsert() {
        TestCase tc = new TestCase(1, Operation.INSERT, null,
                new InsertParams(List.of(Vector.of(Float.NaN, 1f)), List.of("a"), List.of()));
        return new TestResult(tc, List.of(
                DatabaseResult.success("milvus", new InsertData(List.of("a")), 2_000_000),
                DatabaseResult.failure("qdrant", ResultError.of(ErrorKind.SERVICE, "NaN not allowed"), 1_000_000),
                DatabaseResult.failure("chroma", ResultError.of(ErrorKind.UNHEALTHY, "excluded"), 0)),
                List.of("chroma"),
                List.of(new Inconsistency(InconsistencyKind.ERROR_DIVERGENT, DivergenceRule.SUCCESS,
                        List.of("milvus", "qdrant"), "milvus succeeded, qdrant failed")));
    }

    @Test
    void testCompleted_recordsTimersErrorsAndInconsistencies() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsResultSink sink = new MetricsResultSink(registry);

        sink.runStarted(new RunInfo("r", 0, List.of("milvus", "qdrant", "chroma"), List.of("chroma"), null, 1, null));
        sink.testCompleted(nanInsert());
        sink.runEnded(new RunSummary("r", RunStatus.COMPLETED, 1, 1, 0, 1));

        assertEquals(2.0, registry.get(MetricsResultSink.CALL_DURATION)
                .tag("service", "milvus").tag("outcome", "success").timer().totalTime(TimeUnit.MILLISECONDS), 1e-9);
        assertEquals(1, registry.get(MetricsResultSink.CALL_DURATION)
                .tag("service", "qdrant").tag("outcome", "failure").timer().count());
        assertNull(registry.find(MetricsResultSink.CALL_DURATION).tag("service", "chroma").timer());
        assertEquals(1.0, registry.get(MetricsResultSink.CALL_ERRORS)
                .tag("service", "qdrant").tag("kind", "service").counter().count());
        assertEquals(1.0, registry.get(MetricsResultSink.CALL_ERRORS)
                .tag("service", "chroma").tag("kind", "unhealthy").counter().count());
        assertEquals(1.0, registry.get(MetricsResultSink.INCONSISTENCIES)
                .tag("kind", "error-divergent").tag("rule", "SUCCESS").counter().count());
        assertEquals(1.0, registry.get(MetricsResultSink.TESTS)
                .tag("operation", "insert").tag("consistent", "false").counter().count());
    }

    @Test
    void defaultConstructor_usesSimpleRegistry() {
        assertTrue(new MetricsResultSink().getRegistry() instanceof SimpleMeterRegistry);
    }
}
