package com.vdbfuzz.adapter.http;

import com.vdbfuzz.adapter.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthProbeTest {

    private StubHttpServer server;
    private JsonHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
        client = new JsonHttpClient("chroma", server.baseUrl(), Duration.ofSeconds(1), Duration.ofSeconds(2), Map.of());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void probe_fallsBackToLaterEndpoint() {
        server.on("GET", "/api/v2/heartbeat", 404, "{}")
                .on("GET", "/api/v1/heartbeat", 200, "{\"nanosecond heartbeat\":1}");
        HealthProbe probe = new HealthProbe("chroma", List.of(
                HealthProbe.get("/api/v2/heartbeat").dialect("v2"),
                HealthProbe.get("/api/v1/heartbeat").dialect("v1")));

        HealthStatus status = probe.probe(client, Duration.ofSeconds(1));

        assertTrue(status.isReachable());
        assertEquals("GET /api/v1/heartbeat", status.getEndpoint());
        assertEquals("v1", status.getDialect());
        assertEquals(List.of("GET /api/v2/heartbeat", "GET /api/v1/heartbeat"), server.requests);
    }

    @Test
    void probe_readinessPredicateAndVersion() {
        server.on("GET", "/", 200, "{\"title\":\"qdrant\",\"version\":\"1.9.0\"}");
        HealthProbe probe = new HealthProbe("qdrant", List.of(
                HealthProbe.get("/").readyWhen(r -> r.isSuccess() && r.getBody().contains("version"))
                        .version(r -> "1.9.0")));

        HealthStatus status = probe.probe(client, Duration.ofSeconds(1));

        assertTrue(status.isReachable());
        assertEquals("1.9.0", status.getVersion());
    }

    @Test
    void probe_noEndpointReadyIsUnhealthyWithDetail() {
        server.on("GET", "/healthz", 503, "{}");
        HealthProbe probe = new HealthProbe("qdrant", List.of(HealthProbe.get("/healthz"), HealthProbe.get("/collections")));

        HealthStatus status = probe.probe(client, Duration.ofSeconds(1));

        assertFalse(status.isReachable());
        assertTrue(status.getDetail().contains("GET /healthz -> 503"));
        assertTrue(status.getDetail().contains("GET /collections -> 404"));
    }

    @Test
    void constructor_requiresEndpoints() {
        assertThrows(IllegalArgumentException.class, () -> new HealthProbe("x", List.of()));
    }
}
