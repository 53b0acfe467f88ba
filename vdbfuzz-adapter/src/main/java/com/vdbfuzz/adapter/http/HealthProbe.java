package com.vdbfuzz.adapter.http;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Probes a ranked list of health endpoints; the first endpoint that answers with its recognised
 * ready shape wins. Services expose health on different paths across versions, so each adapter
 * supplies its own list, newest API first.
 */
public final class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    private final String service;
    private final List<Endpoint> endpoints;

    public HealthProbe(String service, List<Endpoint> endpoints) {
        this.service = Objects.requireNonNull(service, "service");
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one health endpoint is required for " + service);
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    /** Tries each endpoint in order with the given timeout. Never throws. */
    public HealthStatus probe(JsonHttpClient client, Duration timeout) {
        List<String> failures = new ArrayList<>();
        for (Endpoint e : endpoints) {
            String label = e.method + " " + e.path;
            try {
                HttpReply reply = client.send(e.method, e.path, e.body, timeout);
                if (e.ready.test(reply)) {
                    String version = e.version != null ? e.version.apply(reply) : null;
                    log.debug("{} | health endpoint answered | endpoint={} | dialect={}", service, label, e.dialect);
                    return HealthStatus.healthy(service, label, e.dialect, version);
                }
                failures.add(label + " -> " + reply.getStatus());
            } catch (AdapterException ex) {
                failures.add(label + " -> " + ex.getKind().getWireName());
            } catch (RuntimeException ex) {
                failures.add(label + " -> " + ex.getClass().getSimpleName());
            }
        }
        return HealthStatus.unhealthy(service, String.join(", ", failures));
    }

    public static Endpoint get(String path) {
        return new Endpoint("GET", path, null, HttpReply::isSuccess, null, null);
    }

    public static Endpoint post(String path, Object body) {
        return new Endpoint("POST", path, body, HttpReply::isSuccess, null, null);
    }

    /** One ranked health endpoint: request, readiness check, dialect it implies, optional version extractor. */
    public static final class Endpoint {
        private final String method;
        private final String path;
        private final Object body;
        private final Predicate<HttpReply> ready;
        private final String dialect;
        private final Function<HttpReply, String> version;

        private Endpoint(String method, String path, Object body, Predicate<HttpReply> ready,
                         String dialect, Function<HttpReply, String> version) {
            this.method = method;
            this.path = path;
            this.body = body;
            this.ready = ready;
            this.dialect = dialect;
            this.version = version;
        }

        /** Replaces the readiness check (default: any 2xx). */
        public Endpoint readyWhen(Predicate<HttpReply> ready) {
            return new Endpoint(method, path, body, Objects.requireNonNull(ready, "ready"), dialect, version);
        }

        public Endpoint dialect(String dialect) {
            return new Endpoint(method, path, body, ready, dialect, version);
        }

        public Endpoint version(Function<HttpReply, String> version) {
            return new Endpoint(method, path, body, ready, dialect, version);
        }

        public String getMethod() {
            return method;
        }

        public String getPath() {
            return path;
        }

        public String getDialect() {
            return dialect;
        }
    }
}
