package com.vdbfuzz.adapter.weaviate;

import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.AdapterProvider;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.ServiceConfig;

import java.util.Map;

/** SPI provider for the Weaviate adapter. */
public final class WeaviateAdapterProvider implements AdapterProvider {

    @Override
    public String getServiceName() {
        return "weaviate";
    }

    @Override
    public ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options) {
        return new WeaviateServiceAdapter(config, options);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("protocol", "rest+graphql", "nativeBatchSearch", false, "idTranslation", "uuid");
    }
}
