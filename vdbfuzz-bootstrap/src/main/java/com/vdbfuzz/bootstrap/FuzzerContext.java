package com.vdbfuzz.bootstrap;

import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.engine.FuzzRunner;
import com.vdbfuzz.ledger.ResultSink;
import com.vdbfuzz.ledger.RunStatistics;
import com.vdbfuzz.ledger.RunSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Everything a fuzzing session needs, built by {@link FuzzerBootstrap}. Closing the context closes
 * the runner's thread pools and every adapter.
 */
public final class FuzzerContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FuzzerContext.class);

    private final FuzzerConfig config;
    private final List<ServiceAdapter> adapters;
    private final FuzzRunner runner;
    private final ResultSink sink;
    private final RunStatistics statistics;
    private final MeterRegistry meterRegistry;

    FuzzerContext(FuzzerConfig config, List<ServiceAdapter> adapters, FuzzRunner runner, ResultSink sink,
                  RunStatistics statistics, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.adapters = List.copyOf(adapters);
        this.runner = Objects.requireNonNull(runner, "runner");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.meterRegistry = meterRegistry;
    }

    public FuzzerConfig getConfig() {
        return config;
    }

    public List<ServiceAdapter> getAdapters() {
        return adapters;
    }

    public FuzzRunner getRunner() {
        return runner;
    }

    /** Sink every result flows into (composite of statistics, JSON lines and metrics as configured). */
    public ResultSink getSink() {
        return sink;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    /** Registry the metrics sink records into; null when metrics are disabled. */
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Runs the session and logs the text report. */
    public RunSummary run() {
        RunSummary summary = runner.run();
        log.info("Run report\n{}", statistics.report());
        return summary;
    }

    @Override
    public void close() {
        runner.close();
        for (ServiceAdapter adapter : adapters) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("Adapter close failed | service={} | error={}", adapter.getServiceName(), e.getMessage());
            }
        }
    }
}
