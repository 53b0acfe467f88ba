package com.vdbfuzz.adapter;

import com.vdbfuzz.config.ServiceConfig;

import java.util.Collections;
import java.util.Map;

/**
 * SPI for service adapters. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.vdbfuzz.adapter.AdapterProvider); adding a service needs no engine change.
 */
public interface AdapterProvider {

    /** Service name this provider serves; matched against {@link ServiceConfig#getName()}. */
    String getServiceName();

    /** Creates a new adapter for one configured service. No I/O happens until {@code connect}. */
    ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options);

    /** Adapter version for audit in run records. */
    default String getVersion() {
        return "1.0";
    }

    /**
     * Capability metadata (e.g. protocol, API dialects, native batch search). Empty by default.
     */
    default Map<String, Object> getCapabilityMetadata() {
        return Collections.emptyMap();
    }

    /** Whether this provider should be registered. */
    default boolean isEnabled() {
        return true;
    }
}
