package com.vdbfuzz.adapter;

import com.vdbfuzz.config.ConfigurationException;
import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.config.ServiceConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdapterRegistryTest {

    @Test
    void register_rejectsDuplicateAndBlankNames() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new FixedProvider("Qdrant"));

        assertTrue(registry.contains("qdrant"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FixedProvider("qdrant")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FixedProvider(" ")));
    }

    @Test
    void getAll_keepsRegistrationOrderAndMetadata() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new FixedProvider("milvus"));
        registry.register(new FixedProvider("chroma"));

        assertEquals(List.of("milvus", "chroma"), List.copyOf(registry.getAll().keySet()));
        assertEquals("http", registry.get("chroma").getCapabilityMetadata().get("protocol"));
        assertNull(registry.get("weaviate"));
    }

    @Test
    void createAdapters_missingProviderIsConfigurationError() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new FixedProvider("milvus"));
        FuzzerConfig config = FuzzerConfig.builder()
                .services(List.of(ServiceConfig.defaults("milvus"), ServiceConfig.defaults("qdrant")))
                .build();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> AdapterLoader.createAdapters(registry, config));
        assertTrue(e.getMessage().contains("qdrant"));
    }

    @Test
    void createAdapters_onePerEnabledService() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new FixedProvider("milvus"));
        registry.register(new FixedProvider("qdrant"));
        FuzzerConfig config = FuzzerConfig.builder()
                .services(List.of(ServiceConfig.defaults("milvus"), ServiceConfig.defaults("qdrant")))
                .build();

        List<ServiceAdapter> adapters = AdapterLoader.createAdapters(registry, config);

        assertEquals(2, adapters.size());
        assertEquals("qdrant", adapters.get(1).getServiceName());
        assertEquals("test_collection", adapters.get(1).defaultCollection());
    }

    @Test
    void idCodec_isDeterministic() {
        assertEquals(IdCodec.toUuid("id_1"), IdCodec.toUuid("id_1"));
        assertNotEquals(IdCodec.toUuid("id_1"), IdCodec.toUuid("id_2"));
        assertEquals(36, IdCodec.toUuid("").length());
    }

    private static final class FixedProvider implements AdapterProvider {
        private final String name;

        FixedProvider(String name) {
            this.name = name;
        }

        @Override
        public String getServiceName() {
            return name;
        }

        @Override
        public ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options) {
            return new ServiceAdapter() {
                @Override
                public String getServiceName() {
                    return config.getName();
                }

                @Override
                public ServiceConfig getConfig() {
                    return config;
                }

                @Override
                public void connect() {
                }

                @Override
                public void ensureCollection(String collection, int dimension) {
                }

                @Override
                public List<String> insert(String collection, List<com.vdbfuzz.model.Vector> vectors, List<String> ids,
                                           List<Map<String, Object>> metadata) {
                    return ids;
                }

                @Override
                public List<com.vdbfuzz.model.SearchHit> search(String collection, com.vdbfuzz.model.Vector query, int k,
                                                                com.vdbfuzz.model.Metric metric) {
                    return List.of();
                }

                @Override
                public long delete(String collection, List<String> ids) {
                    return 0;
                }

                @Override
                public void dropCollection(String collection) {
                }

                @Override
                public HealthStatus healthCheck() {
                    return HealthStatus.healthy(config.getName(), "stub", null, null);
                }

                @Override
                public void close() {
                }
            };
        }

        @Override
        public Map<String, Object> getCapabilityMetadata() {
            return Map.of("protocol", "http");
        }
    }
}
