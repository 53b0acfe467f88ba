package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.CallTimeoutException;
import com.vdbfuzz.adapter.ConnectionFailureException;
import com.vdbfuzz.adapter.HealthStatus;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.adapter.ServiceErrorException;
import com.vdbfuzz.config.ServiceConfig;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.SearchHit;
import com.vdbfuzz.model.Vector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brute-force L2 store standing in for a real service. Behaviour knobs let a test make one
 * service disagree with the others.
 */
final class InMemoryServiceAdapter implements ServiceAdapter {

    private final ServiceConfig config;
    private final Map<String, Map<String, Vector>> collections = new ConcurrentHashMap<>();
    final AtomicInteger healthChecks = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean reachable = true;
    volatile boolean rejectNonFinite;
    volatile long delayMillis;
    /** When set, every search answers with exactly these ids. */
    volatile List<String> fixedSearchIds;
    volatile RuntimeException failWith;

    InMemoryServiceAdapter(String name) {
        this.config = ServiceConfig.defaults(name);
    }

    InMemoryServiceAdapter rejectingNonFinite() {
        this.rejectNonFinite = true;
        return this;
    }

    InMemoryServiceAdapter unreachable() {
        this.reachable = false;
        return this;
    }

    InMemoryServiceAdapter delayed(long millis) {
        this.delayMillis = millis;
        return this;
    }

    int size(String collection) {
        Map<String, Vector> c = collections.get(collection);
        return c != null ? c.size() : 0;
    }

    @Override
    public String getServiceName() {
        return config.getName();
    }

    @Override
    public ServiceConfig getConfig() {
        return config;
    }

    @Override
    public void connect() throws AdapterException {
        checkReachable();
    }

    @Override
    public void ensureCollection(String name, int dimension) throws AdapterException {
        checkReachable();
        collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }

    @Override
    public List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                               List<Map<String, Object>> metadata) throws AdapterException {
        enter();
        if (rejectNonFinite) {
            for (Vector v : vectors) {
                if (v.hasNonFinite()) {
                    throw new ServiceErrorException(getServiceName(), "vector contains NaN or Inf", 400,
                            "{\"error\":\"invalid float\"}");
                }
            }
        }
        Map<String, Vector> c = collection(collection);
        List<String> stored = new ArrayList<>();
        for (int i = 0; i < vectors.size() && i < ids.size(); i++) {
            c.put(ids.get(i), vectors.get(i));
            stored.add(ids.get(i));
        }
        return stored;
    }

    @Override
    public List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException {
        enter();
        if (fixedSearchIds != null) {
            List<SearchHit> hits = new ArrayList<>();
            for (int i = 0; i < fixedSearchIds.size() && i < k; i++) {
                hits.add(new SearchHit(fixedSearchIds.get(i), i));
            }
            return hits;
        }
        Map<String, Vector> c = collection(collection);
        Map<String, Double> scores = new LinkedHashMap<>();
        c.forEach((id, v) -> {
            if (v.dimension() == query.dimension()) scores.put(id, l2(v, query));
        });
        List<SearchHit> hits = new ArrayList<>();
        scores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, k))
                .forEach(e -> hits.add(new SearchHit(e.getKey(), e.getValue())));
        return hits;
    }

    @Override
    public long delete(String collection, List<String> ids) throws AdapterException {
        enter();
        Map<String, Vector> c = collection(collection);
        long removed = 0;
        for (String id : ids) {
            if (c.remove(id) != null) removed++;
        }
        return removed;
    }

    @Override
    public void dropCollection(String name) throws AdapterException {
        checkReachable();
        collections.remove(name);
    }

    @Override
    public HealthStatus healthCheck() {
        healthChecks.incrementAndGet();
        return reachable
                ? HealthStatus.healthy(getServiceName(), "GET /memory", "mem", "1.0")
                : HealthStatus.unhealthy(getServiceName(), "GET /memory -> connection refused");
    }

    @Override
    public void close() {
        collections.clear();
    }

    private void enter() throws AdapterException {
        calls.incrementAndGet();
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CallTimeoutException(getServiceName(), "interrupted");
            }
        }
        if (failWith != null) throw failWith;
        checkReachable();
    }

    private void checkReachable() throws AdapterException {
        if (!reachable) {
            throw new ConnectionFailureException(getServiceName(), "connection refused");
        }
    }

    private Map<String, Vector> collection(String name) throws AdapterException {
        Map<String, Vector> c = collections.get(name);
        if (c == null) {
            throw new ServiceErrorException(getServiceName(), "collection not found: " + name, 404,
                    "{\"error\":\"collection " + name + " not found\"}");
        }
        return c;
    }

    private static double l2(Vector a, Vector b) {
        double sum = 0;
        for (int i = 0; i < a.dimension(); i++) {
            double d = a.get(i) - b.get(i);
            sum += d * d;
        }
        return sum;
    }
}
