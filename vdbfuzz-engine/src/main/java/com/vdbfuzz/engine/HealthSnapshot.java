package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.HealthStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of service health taken at a batch boundary. Services keep configuration order.
 */
public final class HealthSnapshot {

    private final Map<String, HealthStatus> statuses;
    private final long takenAtMillis;

    public HealthSnapshot(Map<String, HealthStatus> statuses, long takenAtMillis) {
        Objects.requireNonNull(statuses, "statuses");
        this.statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        this.takenAtMillis = takenAtMillis;
    }

    public Map<String, HealthStatus> getStatuses() {
        return statuses;
    }

    public long getTakenAtMillis() {
        return takenAtMillis;
    }

    /** Status of the service, or null if it is not part of this run. */
    public HealthStatus status(String service) {
        return statuses.get(service);
    }

    public boolean isHealthy(String service) {
        HealthStatus s = statuses.get(service);
        return s != null && s.isReachable();
    }

    public List<String> healthyServices() {
        List<String> out = new ArrayList<>();
        statuses.forEach((name, s) -> {
            if (s.isReachable()) out.add(name);
        });
        return out;
    }

    public List<String> unhealthyServices() {
        List<String> out = new ArrayList<>();
        statuses.forEach((name, s) -> {
            if (!s.isReachable()) out.add(name);
        });
        return out;
    }

    public int reachableCount() {
        return (int) statuses.values().stream().filter(HealthStatus::isReachable).count();
    }

    /** Copy with the given statuses replacing the existing ones. */
    HealthSnapshot with(Map<String, HealthStatus> updates, long nowMillis) {
        Map<String, HealthStatus> merged = new LinkedHashMap<>(statuses);
        merged.putAll(updates);
        return new HealthSnapshot(merged, nowMillis);
    }

    @Override
    public String toString() {
        return "HealthSnapshot{healthy=" + healthyServices() + ", unhealthy=" + unhealthyServices() + "}";
    }
}
