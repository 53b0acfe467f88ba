package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.HealthStatus;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.HealthMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Tracks service reachability and hands out one immutable {@link HealthSnapshot} per batch.
 * <p>
 * {@link HealthMode#DEFAULT}: services unreachable at run start stay excluded for the whole run;
 * services that lose their connection mid-run are re-probed at the next batch boundary (and at
 * every boundary after that until they answer again). {@link HealthMode#STRICT}: every boundary
 * re-probes all services. A positive re-probe interval additionally re-probes every service not
 * excluded for the run once the interval has elapsed.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final List<ServiceAdapter> adapters;
    private final HealthMode mode;
    private final long reprobeIntervalMillis;
    private final LongSupplier clock;
    private final ExecutorService executor;
    private final AtomicReference<HealthSnapshot> current = new AtomicReference<>();
    private final Set<String> pendingReprobe = ConcurrentHashMap.newKeySet();
    private final Set<String> excludedForRun = ConcurrentHashMap.newKeySet();
    private volatile long lastFullProbeMillis;

    public HealthMonitor(List<ServiceAdapter> adapters, HealthMode mode, long reprobeIntervalMillis) {
        this(adapters, mode, reprobeIntervalMillis, System::currentTimeMillis);
    }

    HealthMonitor(List<ServiceAdapter> adapters, HealthMode mode, long reprobeIntervalMillis, LongSupplier clock) {
        this.adapters = List.copyOf(Objects.requireNonNull(adapters, "adapters"));
        this.mode = mode != null ? mode : HealthMode.DEFAULT;
        this.reprobeIntervalMillis = Math.max(0L, reprobeIntervalMillis);
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, this.adapters.size()), r -> {
            Thread t = new Thread(r, "vdbfuzz-health-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HealthMode getMode() {
        return mode;
    }

    /**
     * Probes every service and installs the first snapshot. In default mode the services found
     * unreachable here are excluded for the rest of the run.
     */
    public HealthSnapshot probeAll() {
        Map<String, HealthStatus> statuses = probe(adapters);
        long now = clock.getAsLong();
        lastFullProbeMillis = now;
        pendingReprobe.clear();
        if (mode == HealthMode.DEFAULT) {
            statuses.forEach((name, s) -> {
                if (!s.isReachable()) excludedForRun.add(name);
            });
        }
        HealthSnapshot snapshot = new HealthSnapshot(statuses, now);
        current.set(snapshot);
        statuses.values().forEach(s -> log.info("Service health | service={} | reachable={} | endpoint={} | version={} | detail={}",
                s.getService(), s.isReachable(), s.getEndpoint(), s.getVersion(), s.getDetail()));
        return snapshot;
    }

    /**
     * Snapshot for the next batch. Re-probes whatever the mode, the interval and the connection
     * failures reported since the last boundary call for, then swaps the snapshot atomically.
     */
    public HealthSnapshot snapshotForBatch() {
        HealthSnapshot snapshot = current.get();
        if (snapshot == null) {
            return probeAll();
        }
        long now = clock.getAsLong();
        Set<String> names = new LinkedHashSet<>();
        boolean full = mode == HealthMode.STRICT
                || (reprobeIntervalMillis > 0 && now - lastFullProbeMillis >= reprobeIntervalMillis);
        for (ServiceAdapter adapter : adapters) {
            String name = adapter.getServiceName();
            if (excludedForRun.contains(name)) continue;
            if (full || pendingReprobe.contains(name)) names.add(name);
        }
        if (names.isEmpty()) {
            return snapshot;
        }
        List<ServiceAdapter> targets = new ArrayList<>();
        for (ServiceAdapter adapter : adapters) {
            if (names.contains(adapter.getServiceName())) targets.add(adapter);
        }
        Map<String, HealthStatus> updates = probe(targets);
        if (full) lastFullProbeMillis = now;
        updates.forEach((name, s) -> {
            boolean was = snapshot.isHealthy(name);
            if (s.isReachable()) {
                pendingReprobe.remove(name);
                if (!was) log.info("Service back | service={} | endpoint={}", name, s.getEndpoint());
            } else {
                pendingReprobe.add(name);
                if (was) log.warn("Service lost | service={} | detail={}", name, s.getDetail());
            }
        });
        HealthSnapshot next = snapshot.with(updates, now);
        current.set(next);
        return next;
    }

    /** Latest snapshot, or null before {@link #probeAll()}. */
    public HealthSnapshot current() {
        return current.get();
    }

    /** Schedules the service for a re-probe at the next batch boundary. The current snapshot is unchanged. */
    public void reportConnectionFailure(String service, String detail) {
        if (excludedForRun.contains(service)) return;
        if (pendingReprobe.add(service)) {
            log.warn("Connection failure reported | service={} | detail={} | reprobe=next batch", service, detail);
        }
    }

    /**
     * Marks a service unreachable right away, e.g. when it answered the probe but refused the
     * session. In default mode the service is then excluded for the run.
     */
    public void markUnreachable(String service, String detail) {
        HealthSnapshot snapshot = current.get();
        long now = clock.getAsLong();
        HealthStatus down = HealthStatus.unhealthy(service, detail);
        Map<String, HealthStatus> update = Map.of(service, down);
        current.set(snapshot != null ? snapshot.with(update, now) : new HealthSnapshot(update, now));
        if (mode == HealthMode.DEFAULT) {
            excludedForRun.add(service);
        } else {
            pendingReprobe.add(service);
        }
        log.warn("Service marked unreachable | service={} | detail={}", service, detail);
    }

    Set<String> pendingReprobe() {
        return Set.copyOf(pendingReprobe);
    }

    Set<String> excludedForRun() {
        return Set.copyOf(excludedForRun);
    }

    private Map<String, HealthStatus> probe(Collection<ServiceAdapter> targets) {
        Map<String, CompletableFuture<HealthStatus>> futures = new LinkedHashMap<>();
        for (ServiceAdapter adapter : targets) {
            futures.put(adapter.getServiceName(), CompletableFuture.supplyAsync(() -> check(adapter), executor));
        }
        Map<String, HealthStatus> out = new LinkedHashMap<>();
        futures.forEach((name, f) -> out.put(name, f.join()));
        return out;
    }

    private static HealthStatus check(ServiceAdapter adapter) {
        try {
            HealthStatus status = adapter.healthCheck();
            return status != null ? status : HealthStatus.unhealthy(adapter.getServiceName(), "no status");
        } catch (RuntimeException e) {
            log.warn("Health check raised | service={} | error={}", adapter.getServiceName(), e.toString());
            return HealthStatus.unhealthy(adapter.getServiceName(), e.toString());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
