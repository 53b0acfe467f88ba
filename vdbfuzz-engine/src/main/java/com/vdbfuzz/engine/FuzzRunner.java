package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.HealthStatus;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.generator.FuzzGenerator;
import com.vdbfuzz.ledger.ResultLedger;
import com.vdbfuzz.ledger.ResultSink;
import com.vdbfuzz.ledger.RunInfo;
import com.vdbfuzz.ledger.RunStatus;
import com.vdbfuzz.ledger.RunSummary;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.DivergenceRule;
import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.Inconsistency;
import com.vdbfuzz.model.TestCase;
import com.vdbfuzz.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs a fuzzing session: probes the services, prepares their collections, then generates test
 * cases batch by batch and, for each one, dispatches it, compares the results and hands the
 * {@link TestResult} to the ledger in generation order.
 * <p>
 * The run aborts with {@link RunStatus#ABORTED_NO_REACHABLE_SERVICES} when no service is reachable
 * at a batch boundary. Every other failure is recorded as data.
 */
public final class FuzzRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FuzzRunner.class);

    private final FuzzerConfig config;
    private final List<ServiceAdapter> adapters;
    private final FuzzGenerator generator;
    private final HealthMonitor healthMonitor;
    private final DifferentialDispatcher dispatcher;
    private final ResultComparator comparator;
    private final ResultLedger ledger;

    public FuzzRunner(FuzzerConfig config, List<ServiceAdapter> adapters, ResultSink sink) {
        this(config, adapters, new FuzzGenerator(config.getFuzzSettings()),
                new HealthMonitor(adapters, config.getHealthMode(), config.getHealthReprobeIntervalMillis()),
                sink);
    }

    private FuzzRunner(FuzzerConfig config, List<ServiceAdapter> adapters, FuzzGenerator generator,
                       HealthMonitor healthMonitor, ResultSink sink) {
        this(config, adapters, generator, healthMonitor,
                new DifferentialDispatcher(adapters, healthMonitor,
                        config.getComparisonPolicy().getUnhealthyServicePolicy(),
                        Duration.ofMillis(config.getCallTimeoutMillis()), config.getDispatcherThreads()),
                new ResultComparator(config.getComparisonPolicy()),
                new ResultLedger(sink));
    }

    FuzzRunner(FuzzerConfig config, List<ServiceAdapter> adapters, FuzzGenerator generator,
               HealthMonitor healthMonitor, DifferentialDispatcher dispatcher, ResultComparator comparator,
               ResultLedger ledger) {
        this.config = Objects.requireNonNull(config, "config");
        this.adapters = List.copyOf(Objects.requireNonNull(adapters, "adapters"));
        this.generator = Objects.requireNonNull(generator, "generator");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    /** Runs {@link FuzzerConfig#getTestCount()} test cases. */
    public RunSummary run() {
        String runId = UUID.randomUUID().toString();
        long start = System.currentTimeMillis();
        int planned = config.getTestCount();
        int batchSize = Math.max(1, config.getBatchSize());

        healthMonitor.probeAll();
        prepareCollections();
        HealthSnapshot snapshot = healthMonitor.current();

        List<String> services = new ArrayList<>();
        adapters.forEach(a -> services.add(a.getServiceName()));
        ledger.runStarted(new RunInfo(runId, start, services, snapshot.unhealthyServices(),
                generator.getSettings().getSeed(), planned, adapterVersions(snapshot)));
        log.info("Run started | runId={} | services={} | unreachable={} | tests={} | batchSize={} | seed={}",
                runId, services, snapshot.unhealthyServices(), planned, batchSize, generator.getSettings().getSeed());

        int testsRun = 0;
        int withInconsistencies = 0;
        RunStatus status = RunStatus.COMPLETED;
        try {
            while (testsRun < planned) {
                if (testsRun > 0) {
                    snapshot = healthMonitor.snapshotForBatch();
                }
                if (snapshot.reachableCount() == 0) {
                    status = RunStatus.ABORTED_NO_REACHABLE_SERVICES;
                    log.error("No reachable services; aborting | runId={} | testsRun={} | health={}",
                            runId, testsRun, snapshot);
                    break;
                }
                int end = Math.min(planned, testsRun + batchSize);
                while (testsRun < end) {
                    TestResult result = execute(generator.next(), snapshot);
                    ledger.testCompleted(result);
                    testsRun++;
                    if (result.hasDivergence()) withInconsistencies++;
                }
            }
        } finally {
            if (config.isDropCollectionsOnFinish()) {
                dropCollections();
            }
        }

        RunSummary summary = new RunSummary(runId, status, testsRun, withInconsistencies, start,
                System.currentTimeMillis());
        ledger.runEnded(summary);
        log.info("Run ended | runId={} | status={} | testsRun={} | withInconsistencies={} | durationMs={}",
                runId, status, testsRun, withInconsistencies, summary.getDurationMillis());
        return summary;
    }

    /** Dispatches one test case against the snapshot and compares the results. */
    public TestResult execute(TestCase testCase, HealthSnapshot snapshot) {
        List<DatabaseResult> results = dispatcher.dispatch(testCase, snapshot);
        List<String> excluded = dispatcher.excludedServices(snapshot);
        List<Inconsistency> inconsistencies = comparator.compare(testCase, results, excluded);
        for (Inconsistency i : inconsistencies) {
            if (i.getRule() == DivergenceRule.EXCLUSION) continue;
            log.warn("Inconsistency | testId={} | operation={} | kind={} | rule={} | services={} | detail={}",
                    testCase.getId(), testCase.getOperation().getWireName(), i.getKind().getWireName(),
                    i.getRule().getWireName(), i.getServicesInvolved(), i.getDescription());
        }
        return new TestResult(testCase, results, excluded, inconsistencies);
    }

    private void prepareCollections() {
        int dimension = config.getFuzzSettings().getVectorDimension();
        for (ServiceAdapter adapter : adapters) {
            String name = adapter.getServiceName();
            if (!healthMonitor.current().isHealthy(name)) continue;
            try {
                adapter.connect();
                adapter.ensureCollection(adapter.defaultCollection(), dimension);
                log.info("Collection ready | service={} | collection={} | dimension={}",
                        name, adapter.defaultCollection(), dimension);
            } catch (AdapterException e) {
                if (e.getKind() == ErrorKind.CONNECTION) {
                    healthMonitor.markUnreachable(name, e.getMessage());
                } else {
                    log.warn("Collection setup failed; service stays in the run | service={} | collection={} | kind={} | error={}",
                            name, adapter.defaultCollection(), e.getKind().getWireName(), e.getMessage());
                }
            }
        }
    }

    private void dropCollections() {
        HealthSnapshot snapshot = healthMonitor.current();
        for (ServiceAdapter adapter : adapters) {
            if (snapshot == null || !snapshot.isHealthy(adapter.getServiceName())) continue;
            try {
                adapter.dropCollection(adapter.defaultCollection());
                log.info("Collection dropped | service={} | collection={}",
                        adapter.getServiceName(), adapter.defaultCollection());
            } catch (AdapterException e) {
                log.warn("Collection drop failed | service={} | collection={} | error={}",
                        adapter.getServiceName(), adapter.defaultCollection(), e.getMessage());
            }
        }
    }

    private static Map<String, String> adapterVersions(HealthSnapshot snapshot) {
        Map<String, String> versions = new LinkedHashMap<>();
        for (HealthStatus s : snapshot.getStatuses().values()) {
            if (s.getVersion() != null) versions.put(s.getService(), s.getVersion());
        }
        return versions;
    }

    @Override
    public void close() {
        dispatcher.close();
        healthMonitor.close();
    }
}
