package com.vdbfuzz.adapter;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a health probe: whether the service answered on one of its ranked endpoints, which one,
 * and the version and API dialect it revealed (either may be null).
 */
public final class HealthStatus {

    private final String service;
    private final boolean reachable;
    private final String endpoint;
    private final String dialect;
    private final String version;
    private final String detail;
    private final Instant checkedAt;

    private HealthStatus(String service, boolean reachable, String endpoint, String dialect,
                         String version, String detail, Instant checkedAt) {
        this.service = Objects.requireNonNull(service, "service");
        this.reachable = reachable;
        this.endpoint = endpoint;
        this.dialect = dialect;
        this.version = version;
        this.detail = detail != null ? detail : "";
        this.checkedAt = checkedAt != null ? checkedAt : Instant.now();
    }

    public static HealthStatus healthy(String service, String endpoint, String dialect, String version) {
        return new HealthStatus(service, true, endpoint, dialect, version, "ok", Instant.now());
    }

    public static HealthStatus unhealthy(String service, String detail) {
        return new HealthStatus(service, false, null, null, null, detail, Instant.now());
    }

    public String getService() {
        return service;
    }

    public boolean isReachable() {
        return reachable;
    }

    /** Endpoint that answered, e.g. {@code GET /healthz}; null when unreachable. */
    public String getEndpoint() {
        return endpoint;
    }

    /** API dialect detected from the answering endpoint (e.g. v2, v1); null if not revealed. */
    public String getDialect() {
        return dialect;
    }

    public String getVersion() {
        return version;
    }

    /** Human-readable reason, "ok" when reachable. */
    public String getDetail() {
        return detail;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    @Override
    public String toString() {
        return reachable
                ? service + " healthy via " + endpoint + (version != null ? " (version " + version + ")" : "")
                : service + " unhealthy: " + detail;
    }
}
