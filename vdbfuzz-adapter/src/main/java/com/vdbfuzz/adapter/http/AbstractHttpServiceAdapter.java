package com.vdbfuzz.adapter.http;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.ConnectionFailureException;
import com.vdbfuzz.adapter.HealthStatus;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Base for adapters that speak JSON over HTTP. Owns the transport and the health probe; the
 * subclass supplies its ranked health endpoints and the native calls. {@link #connect()} probes
 * once and remembers the API dialect the answering endpoint implies.
 */
public abstract class AbstractHttpServiceAdapter implements ServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpServiceAdapter.class);

    protected final ServiceConfig config;
    protected final AdapterOptions options;
    protected final JsonHttpClient http;
    private final HealthProbe probe;
    private volatile String dialect;
    private volatile boolean connected;

    protected AbstractHttpServiceAdapter(ServiceConfig config, AdapterOptions options, HealthProbe probe,
                                         Map<String, String> headers) {
        this.config = Objects.requireNonNull(config, "config");
        this.options = Objects.requireNonNull(options, "options");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.http = new JsonHttpClient(config.getName(), config.getBaseUrl(), options.getProbeTimeout(),
                options.getCallTimeout(), headers);
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
        if (connected) return;
        synchronized (this) {
            if (connected) return;
            HealthStatus status = probe.probe(http, options.getProbeTimeout());
            if (!status.isReachable()) {
                throw new ConnectionFailureException(getServiceName(),
                        getServiceName() + " not reachable at " + http.getBaseUrl() + ": " + status.getDetail());
            }
            dialect = status.getDialect();
            connected = true;
            log.info("Connected | service={} | url={} | endpoint={} | dialect={} | version={}",
                    getServiceName(), http.getBaseUrl(), status.getEndpoint(), dialect, status.getVersion());
        }
    }

    /** Connects on first use so a service that came back after the start of the run still works. */
    protected void ensureConnected() throws AdapterException {
        if (!connected) connect();
    }

    /** Dialect detected at connect time (null before connect or when the endpoint does not imply one). */
    protected String dialect() {
        return dialect;
    }

    /** Forgets the detected dialect so the next call probes again. */
    protected void resetConnection() {
        connected = false;
        dialect = null;
    }

    @Override
    public HealthStatus healthCheck() {
        HealthStatus status = probe.probe(http, options.getProbeTimeout());
        if (!status.isReachable()) {
            resetConnection();
        }
        return status;
    }

    @Override
    public void close() {
        connected = false;
        log.debug("Closed adapter | service={}", getServiceName());
    }

    protected static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
