package com.vdbfuzz.bootstrap;

import com.vdbfuzz.config.ConfigurationException;
import com.vdbfuzz.config.FuzzSettings;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.config.ServiceConfig;
import com.vdbfuzz.ledger.RunStatus;
import com.vdbfuzz.ledger.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FuzzerBootstrapTest {

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static FuzzerConfig.Builder unreachableServices() throws IOException {
        List<ServiceConfig> services = new ArrayList<>();
        for (String name : FuzzerConfig.DEFAULT_SERVICES) {
            services.add(ServiceConfig.defaults(name).withEndpoint("127.0.0.1", closedPort()));
        }
        return FuzzerConfig.builder()
                .services(services)
                .testCount(3)
                .batchSize(2)
                .healthProbeTimeoutMillis(300)
                .callTimeoutMillis(500)
                .fuzzSettings(FuzzSettings.builder().vectorDimension(8).seed(3L).build());
    }

    @Test
    void initialize_discoversEveryBuiltInAdapter() throws IOException {
        try (FuzzerContext ctx = FuzzerBootstrap.initialize(unreachableServices().build())) {
            assertEquals(List.of("milvus", "chroma", "qdrant", "weaviate"),
                    ctx.getAdapters().stream().map(a -> a.getServiceName()).collect(Collectors.toList()));
            assertNotNull(ctx.getMeterRegistry());
        }
    }

    @Test
    void run_allServicesDown_abortsWithNoReachableServices(@TempDir Path dir) throws IOException {
        Path results = dir.resolve("results.jsonl");
        FuzzerConfig config = unreachableServices().resultsFile(results.toString()).metricsEnabled(false).build();
        try (FuzzerContext ctx = FuzzerBootstrap.initialize(config)) {
            RunSummary summary = ctx.run();

            assertEquals(RunStatus.ABORTED_NO_REACHABLE_SERVICES, summary.getStatus());
            assertEquals(0, summary.getTestsRun());
            assertEquals(0, ctx.getStatistics().getTotalTests());
            assertNull(ctx.getMeterRegistry());
            assertTrue(Files.exists(results));
            assertEquals(0, Files.size(results));
        }
    }

    @Test
    void initialize_serviceWithoutAdapter_failsFast() {
        FuzzerConfig config = FuzzerConfig.builder()
                .services(List.of(ServiceConfig.defaults("pinecone").withEndpoint("localhost", 1234)))
                .build();
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> FuzzerBootstrap.initialize(config));
        assertTrue(e.getMessage().contains("pinecone"));
    }

    @Test
    void initialize_invalidConfig_rejected() {
        FuzzerConfig config = FuzzerConfig.builder().batchSize(0).build();
        assertThrows(ConfigurationException.class, () -> FuzzerBootstrap.initialize(config));
    }
}
