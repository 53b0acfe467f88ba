package com.vdbfuzz.features.metrics;

import com.vdbfuzz.ledger.ResultSink;
import com.vdbfuzz.ledger.RunInfo;
import com.vdbfuzz.ledger.RunSummary;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.Inconsistency;
import com.vdbfuzz.model.TestResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Result sink that records run metrics in a Micrometer registry:
 * <ul>
 *   <li>{@code vdbfuzz.call.duration} timer, tags service / operation / outcome</li>
 *   <li>{@code vdbfuzz.call.errors} counter, tags service / kind</li>
 *   <li>{@code vdbfuzz.inconsistencies} counter, tags kind / rule</li>
 *   <li>{@code vdbfuzz.tests} counter, tags operation / consistent</li>
 * </ul>
 * Results recorded for services excluded as unhealthy were never dispatched and carry no timing,
 * so they only count as errors.
 */
public final class MetricsResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(MetricsResultSink.class);

    public static final String CALL_DURATION = "vdbfuzz.call.duration";
    public static final String CALL_ERRORS = "vdbfuzz.call.errors";
    public static final String INCONSISTENCIES = "vdbfuzz.inconsistencies";
    public static final String TESTS = "vdbfuzz.tests";

    private final MeterRegistry registry;

    public MetricsResultSink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Sink backed by an in-process {@link SimpleMeterRegistry}. */
    public MetricsResultSink() {
        this(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void runStarted(RunInfo run) {
        log.debug("Metrics recording started | runId={} | registry={}", run.getRunId(), registry.getClass().getSimpleName());
    }

    @Override
    public void testCompleted(TestResult result) {
        String operation = result.getTestCase().getOperation().getWireName();
        for (DatabaseResult r : result.getResults()) {
            if (!result.getExcludedServices().contains(r.getService())) {
                Timer.builder(CALL_DURATION)
                        .tag("service", r.getService())
                        .tag("operation", operation)
                        .tag("outcome", r.isSuccess() ? "success" : "failure")
                        .register(registry)
                        .record(r.getExecutionTimeNanos(), TimeUnit.NANOSECONDS);
            }
            if (!r.isSuccess()) {
                registry.counter(CALL_ERRORS,
                        "service", r.getService(),
                        "kind", r.getError().getKind().getWireName()
                ).increment();
            }
        }
        for (Inconsistency i : result.getInconsistencies()) {
            registry.counter(INCONSISTENCIES,
                    "kind", i.getKind().getWireName(),
                    "rule", i.getRule().name()
            ).increment();
        }
        registry.counter(TESTS,
                "operation", operation,
                "consistent", Boolean.toString(!result.hasDivergence())
        ).increment();
    }

    @Override
    public void runEnded(RunSummary summary) {
        double tests = registry.find(TESTS).counters().stream().mapToDouble(c -> c.count()).sum();
        double inconsistencies = registry.find(INCONSISTENCIES).counters().stream().mapToDouble(c -> c.count()).sum();
        log.info("Run metrics | runId={} | tests={} | inconsistencies={} | status={}",
                summary.getRunId(), (long) tests, (long) inconsistencies, summary.getStatus());
    }
}
