package com.vdbfuzz.adapter;

import com.vdbfuzz.config.ConfigurationException;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.config.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Discovers {@link AdapterProvider}s on the classpath and creates one adapter per enabled service.
 * A provider that fails to load is logged and skipped; a configured service with no provider is a
 * configuration error.
 */
public final class AdapterLoader {

    private static final Logger log = LoggerFactory.getLogger(AdapterLoader.class);

    private AdapterLoader() {
    }

    /** Registry filled from {@link ServiceLoader} using the context class loader. */
    public static AdapterRegistry discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public static AdapterRegistry discover(ClassLoader classLoader) {
        AdapterRegistry registry = new AdapterRegistry();
        Iterator<AdapterProvider> it = ServiceLoader.load(AdapterProvider.class, classLoader).iterator();
        while (true) {
            AdapterProvider provider;
            try {
                if (!it.hasNext()) break;
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.error("Adapter provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (!provider.isEnabled()) {
                log.info("Adapter provider disabled | service={}", provider.getServiceName());
                continue;
            }
            try {
                registry.register(provider);
                log.info("Registered adapter | service={} | version={} | provider={}",
                        provider.getServiceName(), provider.getVersion(), provider.getClass().getName());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping adapter provider {}: {}", provider.getClass().getName(), e.getMessage());
            }
        }
        return registry;
    }

    /**
     * Creates adapters for the enabled services in configuration order.
     *
     * @throws ConfigurationException if an enabled service has no registered provider
     */
    public static List<ServiceAdapter> createAdapters(AdapterRegistry registry, FuzzerConfig config) {
        AdapterOptions options = AdapterOptions.from(config);
        List<String> missing = new ArrayList<>();
        List<ServiceAdapter> adapters = new ArrayList<>();
        for (ServiceConfig service : config.enabledServices()) {
            AdapterRegistry.AdapterEntry entry = registry.get(service.getName());
            if (entry == null) {
                missing.add("no adapter registered for service: " + service.getName());
                continue;
            }
            adapters.add(entry.getProvider().createAdapter(service, options));
        }
        if (!missing.isEmpty()) {
            adapters.forEach(ServiceAdapter::close);
            throw new ConfigurationException(missing);
        }
        return adapters;
    }
}
