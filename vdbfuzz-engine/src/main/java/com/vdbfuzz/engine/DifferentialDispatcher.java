package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.HealthStatus;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.UnhealthyServicePolicy;
import com.vdbfuzz.model.DatabaseResult;
import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.MixedData;
import com.vdbfuzz.model.ResultData;
import com.vdbfuzz.model.ResultError;
import com.vdbfuzz.model.StepOutcome;
import com.vdbfuzz.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans one test case out to every service in the batch's health snapshot and waits for all of
 * them. Each invocation has its own deadline; a late invocation is cancelled and recorded as
 * {@link ErrorKind#TIMEOUT} without affecting the others. Every failure becomes data.
 */
public final class DifferentialDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DifferentialDispatcher.class);

    private final List<ServiceAdapter> adapters;
    private final HealthMonitor healthMonitor;
    private final UnhealthyServicePolicy unhealthyPolicy;
    private final Duration callTimeout;
    private final ExecutorService executor;

    /**
     * @param threads pool size; 0 or less means one thread per adapter
     */
    public DifferentialDispatcher(List<ServiceAdapter> adapters, HealthMonitor healthMonitor,
                                  UnhealthyServicePolicy unhealthyPolicy, Duration callTimeout, int threads) {
        this.adapters = List.copyOf(Objects.requireNonNull(adapters, "adapters"));
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.unhealthyPolicy = unhealthyPolicy != null ? unhealthyPolicy : UnhealthyServicePolicy.EXCLUDE;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        int size = threads > 0 ? threads : Math.max(1, this.adapters.size());
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "vdbfuzz-dispatch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public UnhealthyServicePolicy getUnhealthyPolicy() {
        return unhealthyPolicy;
    }

    /**
     * Services left out of the comparison under the current policy: the snapshot's unhealthy
     * services when excluding, none when they are recorded as failed.
     */
    public List<String> excludedServices(HealthSnapshot snapshot) {
        if (unhealthyPolicy == UnhealthyServicePolicy.RECORD_AS_FAILED) return List.of();
        List<String> out = new ArrayList<>();
        for (ServiceAdapter adapter : adapters) {
            if (!snapshot.isHealthy(adapter.getServiceName())) out.add(adapter.getServiceName());
        }
        return out;
    }

    /**
     * Runs the test case on every healthy service concurrently. Results come back in adapter
     * order; unhealthy services appear as {@link ErrorKind#UNHEALTHY} failures only under
     * {@link UnhealthyServicePolicy#RECORD_AS_FAILED}.
     */
    public List<DatabaseResult> dispatch(TestCase testCase, HealthSnapshot snapshot) {
        long deadlineNanos = callTimeout.toNanos() * (OperationInvoker.expectedCalls(testCase) + 1L);
        Map<String, Invocation> invocations = new LinkedHashMap<>();
        Map<String, DatabaseResult> immediate = new LinkedHashMap<>();
        for (ServiceAdapter adapter : adapters) {
            String name = adapter.getServiceName();
            if (snapshot.isHealthy(name)) {
                AtomicLong startedAt = new AtomicLong();
                Future<DatabaseResult> future = executor.submit(() -> {
                    startedAt.set(System.nanoTime());
                    return invoke(adapter, testCase);
                });
                invocations.put(name, new Invocation(future, startedAt));
            } else if (unhealthyPolicy == UnhealthyServicePolicy.RECORD_AS_FAILED) {
                HealthStatus status = snapshot.status(name);
                String detail = status != null ? status.getDetail() : "not probed";
                immediate.put(name, DatabaseResult.failure(name,
                        ResultError.of(ErrorKind.UNHEALTHY, "service unhealthy at dispatch: " + detail), 0L));
            }
        }

        Map<String, DatabaseResult> settled = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<String, Invocation> e : invocations.entrySet()) {
            String name = e.getKey();
            Invocation invocation = e.getValue();
            try {
                if (interrupted) throw new InterruptedException();
                settled.put(name, invocation.await(deadlineNanos));
            } catch (TimeoutException ex) {
                invocation.future.cancel(true);
                log.warn("Call timed out | service={} | testId={} | operation={} | deadlineMs={} | started={}",
                        name, testCase.getId(), testCase.getOperation().getWireName(),
                        TimeUnit.NANOSECONDS.toMillis(deadlineNanos), invocation.hasStarted());
                String message = invocation.hasStarted()
                        ? "call exceeded deadline of " + TimeUnit.NANOSECONDS.toMillis(deadlineNanos) + " ms"
                        : "call not started within " + TimeUnit.NANOSECONDS.toMillis(deadlineNanos)
                                + " ms; dispatcher pool saturated";
                settled.put(name, DatabaseResult.failure(name, ResultError.of(ErrorKind.TIMEOUT, message),
                        invocation.elapsedNanos()));
            } catch (InterruptedException ex) {
                interrupted = true;
                invocation.future.cancel(true);
                settled.put(name, DatabaseResult.failure(name,
                        ResultError.of(ErrorKind.TIMEOUT, "dispatch interrupted"), invocation.elapsedNanos()));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Invocation failed outside the adapter | service={} | testId={} | error={}",
                        name, testCase.getId(), cause.toString(), cause);
                settled.put(name, DatabaseResult.failure(name,
                        ResultError.of(ErrorKind.UNEXPECTED, cause.toString()), invocation.elapsedNanos()));
            }
        }
        if (interrupted) Thread.currentThread().interrupt();

        List<DatabaseResult> out = new ArrayList<>(settled.size() + immediate.size());
        for (ServiceAdapter adapter : adapters) {
            String name = adapter.getServiceName();
            DatabaseResult r = settled.containsKey(name) ? settled.get(name) : immediate.get(name);
            if (r != null) out.add(r);
        }
        return out;
    }

    private DatabaseResult invoke(ServiceAdapter adapter, TestCase testCase) {
        String name = adapter.getServiceName();
        long start = System.nanoTime();
        try {
            ResultData data = OperationInvoker.invoke(adapter, testCase);
            long elapsed = System.nanoTime() - start;
            if (data instanceof MixedData mixed) {
                for (StepOutcome step : mixed.getSteps()) {
                    if (!step.isSuccess() && step.getError().getKind() == ErrorKind.CONNECTION) {
                        healthMonitor.reportConnectionFailure(name, step.getError().getMessage());
                        break;
                    }
                }
            }
            log.debug("Call done | service={} | testId={} | operation={} | tookMs={}",
                    name, testCase.getId(), testCase.getOperation().getWireName(),
                    TimeUnit.NANOSECONDS.toMillis(elapsed));
            return DatabaseResult.success(name, data, elapsed);
        } catch (AdapterException e) {
            long elapsed = System.nanoTime() - start;
            if (e.getKind() == ErrorKind.CONNECTION) {
                healthMonitor.reportConnectionFailure(name, e.getMessage());
            }
            log.debug("Call failed | service={} | testId={} | kind={} | error={}",
                    name, testCase.getId(), e.getKind().getWireName(), e.getMessage());
            return DatabaseResult.failure(name, e.toResultError(), elapsed);
        } catch (RuntimeException e) {
            long elapsed = System.nanoTime() - start;
            log.warn("Adapter raised unexpected exception | service={} | testId={} | error={}",
                    name, testCase.getId(), e.toString(), e);
            return DatabaseResult.failure(name, ResultError.of(ErrorKind.UNEXPECTED, e.toString()), elapsed);
        }
    }

    /**
     * One submitted call. The deadline runs from the moment a pool thread picks the call up, so a
     * call queued behind a slow sibling is not charged for the wait.
     */
    private static final class Invocation {
        final Future<DatabaseResult> future;
        final AtomicLong startedAt;

        Invocation(Future<DatabaseResult> future, AtomicLong startedAt) {
            this.future = future;
            this.startedAt = startedAt;
        }

        boolean hasStarted() {
            return startedAt.get() != 0L;
        }

        long elapsedNanos() {
            long begun = startedAt.get();
            return begun == 0L ? 0L : System.nanoTime() - begun;
        }

        /**
         * Waits for the call to settle within {@code deadlineNanos} of its own start. A call that
         * has not started gets the same budget, counted from when the wait began; callers await in
         * submission order, so every call queued ahead of it has settled by then.
         */
        DatabaseResult await(long deadlineNanos) throws InterruptedException, ExecutionException, TimeoutException {
            long waitFrom = System.nanoTime();
            while (true) {
                long begun = startedAt.get();
                long from = begun != 0L ? begun : waitFrom;
                long remaining = deadlineNanos - (System.nanoTime() - from);
                try {
                    return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    // started while we waited on the queue budget: re-arm from the real start
                    if (begun != 0L || startedAt.get() == 0L) throw e;
                }
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
