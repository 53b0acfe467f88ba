package com.vdbfuzz.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of adapter providers by service name. One instance per run; there is no global
 * registry.
 */
public final class AdapterRegistry {

    /** serviceName → entry, in registration order */
    private final Map<String, AdapterEntry> providers = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Registers a provider under its service name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(AdapterProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String name = normalize(provider.getServiceName());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Adapter service name must be non-blank: " + provider.getClass().getName());
        }
        AdapterEntry entry = new AdapterEntry(name, provider.getVersion(), provider.getCapabilityMetadata(), provider);
        if (providers.putIfAbsent(name, entry) != null) {
            throw new IllegalArgumentException("Adapter already registered for service: " + name);
        }
    }

    /** Entry for the service, or null if none is registered. */
    public AdapterEntry get(String serviceName) {
        if (serviceName == null) return null;
        return providers.get(normalize(serviceName));
    }

    public boolean contains(String serviceName) {
        return get(serviceName) != null;
    }

    /** Snapshot of all entries by service name. */
    public Map<String, AdapterEntry> getAll() {
        synchronized (providers) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        }
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        providers.clear();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    /** Registered provider with its version and capability metadata. */
    public static final class AdapterEntry {
        private final String serviceName;
        private final String version;
        private final Map<String, Object> capabilityMetadata;
        private final AdapterProvider provider;

        AdapterEntry(String serviceName, String version, Map<String, Object> capabilityMetadata, AdapterProvider provider) {
            this.serviceName = serviceName;
            this.version = version;
            this.capabilityMetadata = capabilityMetadata != null ? Map.copyOf(capabilityMetadata) : Map.of();
            this.provider = provider;
        }

        public String getServiceName() {
            return serviceName;
        }

        public String getVersion() {
            return version;
        }

        /** Immutable, never null. */
        public Map<String, Object> getCapabilityMetadata() {
            return capabilityMetadata;
        }

        public AdapterProvider getProvider() {
            return provider;
        }
    }
}
