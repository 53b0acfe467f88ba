package com.vdbfuzz.bootstrap;

import com.vdbfuzz.adapter.AdapterLoader;
import com.vdbfuzz.adapter.AdapterRegistry;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.engine.FuzzRunner;
import com.vdbfuzz.features.metrics.MetricsResultSink;
import com.vdbfuzz.ledger.CompositeResultSink;
import com.vdbfuzz.ledger.JsonLinesResultSink;
import com.vdbfuzz.ledger.ResultSink;
import com.vdbfuzz.ledger.RunStatistics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bootstrap for the fuzzer: validates configuration, discovers adapter providers on the classpath,
 * creates one adapter per enabled service, assembles the result sinks and returns a
 * {@link FuzzerContext} whose runner is ready to start.
 */
public final class FuzzerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(FuzzerBootstrap.class);

    private FuzzerBootstrap() {
    }

    /** Configuration from {@code VDBFUZZ_*} environment variables (or the file they point to). */
    public static FuzzerContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(FuzzerConfig.fromEnvironment());
    }

    /**
     * @throws com.vdbfuzz.config.ConfigurationException if the configuration is invalid or an enabled
     *                                                   service has no adapter on the classpath
     */
    public static FuzzerContext initialize(FuzzerConfig config) {
        return initialize(config, AdapterLoader.discover());
    }

    static FuzzerContext initialize(FuzzerConfig config, AdapterRegistry registry) {
        config.validate();
        log.info("Bootstrap: configuration valid; services={} | tests={} | batchSize={} | healthMode={} | callTimeoutMs={}",
                config.enabledServices().stream().map(s -> s.getName() + "@" + s.getBaseUrl()).collect(Collectors.toList()),
                config.getTestCount(), config.getBatchSize(), config.getHealthMode(), config.getCallTimeoutMillis());
        if (registry.getAll().isEmpty()) {
            log.warn("No adapter providers found on the classpath");
        }
        List<ServiceAdapter> adapters = AdapterLoader.createAdapters(registry, config);

        RunStatistics statistics = new RunStatistics();
        List<ResultSink> sinks = new ArrayList<>();
        sinks.add(statistics);
        if (config.getResultsFile() != null) {
            sinks.add(new JsonLinesResultSink(Path.of(config.getResultsFile())));
            log.info("Bootstrap: recording raw results to {}", Path.of(config.getResultsFile()).toAbsolutePath());
        }
        MeterRegistry meterRegistry = null;
        if (config.isMetricsEnabled()) {
            meterRegistry = new SimpleMeterRegistry();
            sinks.add(new MetricsResultSink(meterRegistry));
        }
        ResultSink sink = new CompositeResultSink(sinks);

        FuzzRunner runner = new FuzzRunner(config, adapters, sink);
        log.info("Bootstrap: ready with {} adapter(s) and {} result sink(s)", adapters.size(), sinks.size());
        return new FuzzerContext(config, adapters, runner, sink, statistics, meterRegistry);
    }
}
