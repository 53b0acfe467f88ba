package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.HealthMode;
import com.vdbfuzz.config.UnhealthyServicePolicy;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.DeleteData;
import com.vdbfuzz.model.DeleteParams;
import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.TestCase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DifferentialDispatcherTest {

    private HealthMonitor monitor;
    private DifferentialDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.close();
        if (monitor != null) monitor.close();
    }

    private HealthSnapshot start(List<ServiceAdapter> adapters, UnhealthyServicePolicy policy, Duration timeout)
            throws Exception {
        return start(adapters, policy, timeout, 0);
    }

    private HealthSnapshot start(List<ServiceAdapter> adapters, UnhealthyServicePolicy policy, Duration timeout,
                                 int threads) throws Exception {
        monitor = new HealthMonitor(adapters, HealthMode.DEFAULT, 0);
        dispatcher = new DifferentialDispatcher(adapters, monitor, policy, timeout, threads);
        HealthSnapshot snapshot = monitor.probeAll();
        for (ServiceAdapter a : adapters) {
            if (snapshot.isHealthy(a.getServiceName())) a.ensureCollection(a.defaultCollection(), 2);
        }
        return snapshot;
    }

    private static TestCase deleteCase() {
        return new TestCase(1, Operation.DELETE, null, new DeleteParams(List.of("missing")));
    }

    @Test
    void dispatch_resultsInAdapterOrder() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        HealthSnapshot snapshot = start(List.of(milvus, qdrant), UnhealthyServicePolicy.EXCLUDE, Duration.ofSeconds(5));

        List<DatabaseResult> results = dispatcher.dispatch(deleteCase(), snapshot);
        assertEquals(2, results.size());
        assertEquals("milvus", results.get(0).getService());
        assertEquals("qdrant", results.get(1).getService());
        assertEquals(new DeleteData(0), results.get(0).getData());
    }

    @Test
    void dispatch_timeoutCancelsOnlyTheSlowService() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        HealthSnapshot snapshot = start(List.of(milvus, qdrant), UnhealthyServicePolicy.EXCLUDE, Duration.ofMillis(100));
        qdrant.delayed(10_000);

        long t0 = System.nanoTime();
        List<DatabaseResult> results = dispatcher.dispatch(deleteCase(), snapshot);
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals(ErrorKind.TIMEOUT, results.get(1).getError().getKind());
        assertTrue(tookMs < 5_000, "dispatch waited for the slow call: " + tookMs + "ms");
    }

    @Test
    void dispatch_singleThread_queuedCallKeepsItsOwnDeadline() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        // delete implies one call, so each deadline is 2 x 300 ms
        HealthSnapshot snapshot = start(List.of(milvus, qdrant), UnhealthyServicePolicy.EXCLUDE,
                Duration.ofMillis(300), 1);
        milvus.delayed(400);
        qdrant.delayed(300);

        List<DatabaseResult> results = dispatcher.dispatch(deleteCase(), snapshot);

        assertTrue(results.get(0).isSuccess(), () -> "milvus: " + results.get(0).getError());
        assertTrue(results.get(1).isSuccess(), () -> "qdrant: " + results.get(1).getError());
        assertEquals(new DeleteData(0), results.get(1).getData());
    }

    @Test
    void dispatch_connectionFailureReportedForReprobe() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        HealthSnapshot snapshot = start(List.of(milvus, qdrant), UnhealthyServicePolicy.EXCLUDE, Duration.ofSeconds(5));
        qdrant.reachable = false;

        List<DatabaseResult> results = dispatcher.dispatch(deleteCase(), snapshot);
        assertEquals(ErrorKind.CONNECTION, results.get(1).getError().getKind());
        assertTrue(monitor.pendingReprobe().contains("qdrant"));
    }

    @Test
    void dispatch_runtimeExceptionBecomesUnexpected() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        HealthSnapshot snapshot = start(List.of(milvus, qdrant), UnhealthyServicePolicy.EXCLUDE, Duration.ofSeconds(5));
        qdrant.failWith = new IllegalStateException("boom");

        DatabaseResult r = dispatcher.dispatch(deleteCase(), snapshot).get(1);
        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.UNEXPECTED, r.getError().getKind());
        assertTrue(r.getError().getMessage().contains("boom"));
    }

    @Test
    void dispatch_unhealthyExcludedOrRecordedPerPolicy() throws Exception {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        InMemoryServiceAdapter chroma = new InMemoryServiceAdapter("chroma").unreachable();
        List<ServiceAdapter> adapters = List.of(milvus, qdrant, chroma);

        HealthSnapshot snapshot = start(adapters, UnhealthyServicePolicy.EXCLUDE, Duration.ofSeconds(5));
        assertEquals(2, dispatcher.dispatch(deleteCase(), snapshot).size());
        assertEquals(List.of("chroma"), dispatcher.excludedServices(snapshot));
        assertEquals(0, chroma.calls.get());
        tearDown();

        snapshot = start(adapters, UnhealthyServicePolicy.RECORD_AS_FAILED, Duration.ofSeconds(5));
        List<DatabaseResult> results = dispatcher.dispatch(deleteCase(), snapshot);
        assertEquals(3, results.size());
        assertEquals(ErrorKind.UNHEALTHY, results.get(2).getError().getKind());
        assertTrue(dispatcher.excludedServices(snapshot).isEmpty());
        assertEquals(0, chroma.calls.get());
    }
}
