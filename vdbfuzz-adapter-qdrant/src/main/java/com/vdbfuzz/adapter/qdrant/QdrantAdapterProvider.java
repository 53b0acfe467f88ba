package com.vdbfuzz.adapter.qdrant;

import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.AdapterProvider;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.ServiceConfig;

import java.util.Map;

/** SPI provider for the Qdrant adapter. */
public final class QdrantAdapterProvider implements AdapterProvider {

    @Override
    public String getServiceName() {
        return "qdrant";
    }

    @Override
    public ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options) {
        return new QdrantServiceAdapter(config, options);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("protocol", "rest", "nativeBatchSearch", true, "idTranslation", "uuid");
    }
}
