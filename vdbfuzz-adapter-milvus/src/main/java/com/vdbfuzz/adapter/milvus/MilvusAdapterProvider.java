package com.vdbfuzz.adapter.milvus;

import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.AdapterProvider;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.ServiceConfig;

import java.util.List;
import java.util.Map;

/** SPI provider for the Milvus adapter. */
public final class MilvusAdapterProvider implements AdapterProvider {

    @Override
    public String getServiceName() {
        return "milvus";
    }

    @Override
    public ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options) {
        return new MilvusServiceAdapter(config, options);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("protocol", "rest", "dialects", List.of("v2", "v1"), "nativeBatchSearch", false);
    }
}
