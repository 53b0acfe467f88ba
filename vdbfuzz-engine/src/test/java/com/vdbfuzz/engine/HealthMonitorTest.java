package com.vdbfuzz.engine;

import com.vdbfuzz.config.HealthMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    @Test
    void defaultMode_unhealthyAtStartStaysExcluded() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant").unreachable();
        try (HealthMonitor monitor = new HealthMonitor(List.of(milvus, qdrant), HealthMode.DEFAULT, 0)) {
            HealthSnapshot first = monitor.probeAll();
            assertEquals(List.of("milvus"), first.healthyServices());
            assertEquals(List.of("qdrant"), first.unhealthyServices());

            qdrant.reachable = true;
            HealthSnapshot next = monitor.snapshotForBatch();
            assertFalse(next.isHealthy("qdrant"));
            assertEquals(1, qdrant.healthChecks.get());
        }
    }

    @Test
    void defaultMode_connectionFailureReprobedAtNextBoundary() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant");
        try (HealthMonitor monitor = new HealthMonitor(List.of(milvus, qdrant), HealthMode.DEFAULT, 0)) {
            monitor.probeAll();
            qdrant.reachable = false;
            monitor.reportConnectionFailure("qdrant", "connection refused");
            assertTrue(monitor.current().isHealthy("qdrant"), "snapshot is fixed until the boundary");

            HealthSnapshot lost = monitor.snapshotForBatch();
            assertFalse(lost.isHealthy("qdrant"));
            assertEquals(1, milvus.healthChecks.get(), "only the reported service is re-probed");

            qdrant.reachable = true;
            HealthSnapshot back = monitor.snapshotForBatch();
            assertTrue(back.isHealthy("qdrant"));
            assertTrue(monitor.pendingReprobe().isEmpty());
        }
    }

    @Test
    void strictMode_reprobesEveryServiceEachBatch() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        InMemoryServiceAdapter qdrant = new InMemoryServiceAdapter("qdrant").unreachable();
        try (HealthMonitor monitor = new HealthMonitor(List.of(milvus, qdrant), HealthMode.STRICT, 0)) {
            monitor.probeAll();
            qdrant.reachable = true;
            HealthSnapshot next = monitor.snapshotForBatch();
            assertTrue(next.isHealthy("qdrant"));
            assertEquals(2, milvus.healthChecks.get());
            assertEquals(2, qdrant.healthChecks.get());
        }
    }

    @Test
    void reprobeInterval_appliesOnlyOnceElapsed() {
        AtomicLong now = new AtomicLong(1_000);
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        try (HealthMonitor monitor = new HealthMonitor(List.of(milvus), HealthMode.DEFAULT, 500, now::get)) {
            monitor.probeAll();
            now.set(1_200);
            monitor.snapshotForBatch();
            assertEquals(1, milvus.healthChecks.get());
            now.set(1_600);
            HealthSnapshot later = monitor.snapshotForBatch();
            assertEquals(2, milvus.healthChecks.get());
            assertEquals(1_600, later.getTakenAtMillis());
        }
    }

    @Test
    void markUnreachable_excludesForRunInDefaultMode() {
        InMemoryServiceAdapter milvus = new InMemoryServiceAdapter("milvus");
        try (HealthMonitor monitor = new HealthMonitor(List.of(milvus), HealthMode.DEFAULT, 0)) {
            monitor.probeAll();
            monitor.markUnreachable("milvus", "auth rejected");
            assertEquals(0, monitor.current().reachableCount());
            assertTrue(monitor.excludedForRun().contains("milvus"));
            assertEquals("auth rejected", monitor.current().status("milvus").getDetail());
        }
    }
}
