package com.vdbfuzz.adapter.chroma;

import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.AdapterProvider;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.config.ServiceConfig;

import java.util.List;
import java.util.Map;

/** SPI provider for the Chroma adapter. */
public final class ChromaAdapterProvider implements AdapterProvider {

    @Override
    public String getServiceName() {
        return "chroma";
    }

    @Override
    public ServiceAdapter createAdapter(ServiceConfig config, AdapterOptions options) {
        return new ChromaServiceAdapter(config, options);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("protocol", "rest", "dialects", List.of("v2", "v1"), "nativeBatchSearch", true);
    }
}
