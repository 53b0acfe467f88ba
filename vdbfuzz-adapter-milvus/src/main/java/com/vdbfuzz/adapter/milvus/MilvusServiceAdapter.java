package com.vdbfuzz.adapter.milvus;

import com.fasterxml.jackson.databind.JsonNode;
import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.ProtocolViolationException;
import com.vdbfuzz.adapter.ServiceErrorException;
import com.vdbfuzz.adapter.http.AbstractHttpServiceAdapter;
import com.vdbfuzz.adapter.http.HealthProbe;
import com.vdbfuzz.adapter.http.HttpReply;
import com.vdbfuzz.adapter.http.JsonHttpClient;
import com.vdbfuzz.config.ServiceConfig;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.SearchHit;
import com.vdbfuzz.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Milvus over its RESTful API on the proxy port (default 19530). Uses the v2 endpoints
 * ({@code /v2/vectordb/...}) and falls back to the v1 ones ({@code /v1/vector/...}) on servers that
 * only answer those. Milvus replies HTTP 200 even on failure; a non-zero {@code code} field is the
 * service error.
 * <p>
 * The primary key is a VarChar field named {@code id}, so caller ids are sent verbatim. The search
 * metric is forwarded as {@code metricType}; the service decides whether it matches the index.
 */
public final class MilvusServiceAdapter extends AbstractHttpServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(MilvusServiceAdapter.class);

    static final String V2 = "v2";
    static final String V1 = "v1";
    private static final int MAX_ID_LENGTH = 65535;

    public MilvusServiceAdapter(ServiceConfig config, AdapterOptions options) {
        super(config, options, healthProbe(config.getName()), authHeaders(config));
    }

    static HealthProbe healthProbe(String service) {
        return new HealthProbe(service, List.of(
                HealthProbe.post("/v2/vectordb/collections/list", Map.of()).readyWhen(MilvusServiceAdapter::codeOk).dialect(V2),
                HealthProbe.get("/v1/vector/collections").readyWhen(MilvusServiceAdapter::codeOk).dialect(V1),
                HealthProbe.get("/healthz").dialect(V2)));
    }

    static boolean codeOk(HttpReply reply) {
        if (!reply.isSuccess()) return false;
        JsonNode code = reply.bodyTree().path("code");
        return code.isInt() && (code.asInt() == 0 || code.asInt() == 200);
    }

    private static Map<String, String> authHeaders(ServiceConfig config) {
        if (hasText(config.getUsername()) && hasText(config.getPassword())) {
            return Map.of("Authorization", "Bearer " + config.getUsername() + ":" + config.getPassword());
        }
        if (hasText(config.getPassword())) {
            return Map.of("Authorization", "Bearer " + config.getPassword());
        }
        return Map.of();
    }

    static String metricName(Metric metric) {
        return switch (metric) {
            case L2 -> "L2";
            case COSINE -> "COSINE";
            case INNER_PRODUCT -> "IP";
        };
    }

    private boolean v1() {
        return V1.equals(dialect());
    }

    private Map<String, Object> body(String collection) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collectionName", collection);
        if (hasText(config.getDatabase())) body.put("dbName", config.getDatabase());
        return body;
    }

    /** Sends the call and returns the parsed reply when both the HTTP status and the Milvus code are OK. */
    private JsonNode call(String path, Map<String, Object> body, String operation) throws AdapterException {
        HttpReply reply = http.requireSuccess(http.post(path, body), operation);
        JsonNode root = http.parse(reply, operation);
        JsonNode code = root.get("code");
        if (code == null) {
            throw http.protocolViolation(reply, operation, "missing 'code'");
        }
        int c = code.asInt();
        if (c != 0 && c != 200) {
            throw new ServiceErrorException(getServiceName(),
                    getServiceName() + " " + operation + " failed: code " + c + " " + root.path("message").asText(),
                    reply.getStatus(), reply.getBody());
        }
        return root;
    }

    @Override
    public void ensureCollection(String name, int dimension) throws AdapterException {
        ensureConnected();
        if (exists(name)) return;
        Map<String, Object> body = body(name);
        if (v1()) {
            body.put("dimension", dimension);
            body.put("metricType", metricName(options.getCollectionMetric()));
            body.put("primaryField", "id");
            body.put("vectorField", "vector");
            call("/v1/vector/collections/create", body, "create collection");
        } else {
            body.put("dimension", dimension);
            body.put("metricType", metricName(options.getCollectionMetric()));
            body.put("idType", "VarChar");
            body.put("primaryFieldName", "id");
            body.put("vectorFieldName", "vector");
            body.put("autoId", false);
            body.put("params", Map.of("max_length", MAX_ID_LENGTH));
            call("/v2/vectordb/collections/create", body, "create collection");
        }
        log.info("Collection ready | service={} | collection={} | dimension={} | metric={}",
                getServiceName(), name, dimension, metricName(options.getCollectionMetric()));
    }

    private boolean exists(String name) throws AdapterException {
        if (v1()) {
            HttpReply reply = http.get("/v1/vector/collections/describe?collectionName=" + JsonHttpClient.segment(name));
            if (!reply.isSuccess()) return false;
            return http.parse(reply, "describe collection").path("code").asInt() == 200;
        }
        JsonNode root = call("/v2/vectordb/collections/has", body(name), "has collection");
        return root.path("data").path("has").asBoolean(false);
    }

    @Override
    public List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                               List<Map<String, Object>> metadata) throws AdapterException {
        ensureConnected();
        List<Map<String, Object>> rows = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i < ids.size() ? ids.get(i) : null);
            row.put("vector", vectors.get(i));
            Map<String, Object> m = metadata != null && i < metadata.size() ? metadata.get(i) : null;
            if (m != null) row.put("metadata", m);
            rows.add(row);
        }
        Map<String, Object> body = body(collection);
        body.put("data", rows);
        JsonNode data = call(v1() ? "/v1/vector/insert" : "/v2/vectordb/entities/insert", body, "insert").path("data");
        JsonNode insertIds = data.get("insertIds");
        if (insertIds == null || !insertIds.isArray()) {
            // older servers report only a count
            int count = data.path("insertCount").asInt(rows.size());
            return new ArrayList<>(ids.subList(0, Math.min(count, ids.size())));
        }
        List<String> stored = new ArrayList<>(insertIds.size());
        insertIds.forEach(n -> stored.add(n.asText()));
        return stored;
    }

    @Override
    public List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException {
        ensureConnected();
        Map<String, Object> body = body(collection);
        JsonNode root;
        if (v1()) {
            body.put("vector", query);
            body.put("limit", k);
            body.put("outputFields", List.of("id"));
            body.put("params", Map.of("metric_type", metricName(metric)));
            root = call("/v1/vector/search", body, "search");
        } else {
            body.put("data", List.of(query));
            body.put("annsField", "vector");
            body.put("limit", k);
            body.put("outputFields", List.of("id"));
            body.put("consistencyLevel", "Strong");
            body.put("searchParams", Map.of("metricType", metricName(metric)));
            root = call("/v2/vectordb/entities/search", body, "search");
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isArray()) {
            throw new ProtocolViolationException(getServiceName(), getServiceName() + " search returned no 'data' array",
                    null, root.toString());
        }
        List<SearchHit> hits = new ArrayList<>(data.size());
        for (JsonNode hit : data) {
            hits.add(new SearchHit(hit.path("id").asText(), hit.path("distance").asDouble()));
        }
        return hits;
    }

    @Override
    public long delete(String collection, List<String> ids) throws AdapterException {
        ensureConnected();
        Map<String, Object> lookup = body(collection);
        lookup.put("id", ids);
        lookup.put("outputFields", List.of("id"));
        JsonNode existing = call(v1() ? "/v1/vector/get" : "/v2/vectordb/entities/get", lookup, "get").path("data");
        long preCount = existing.isArray() ? existing.size() : 0;

        Map<String, Object> body = body(collection);
        if (v1()) {
            body.put("id", ids);
        } else {
            body.put("filter", inFilter(ids));
        }
        JsonNode data = call(v1() ? "/v1/vector/delete" : "/v2/vectordb/entities/delete", body, "delete").path("data");
        JsonNode nativeCount = data.get("deleteCount");
        return nativeCount != null && nativeCount.isNumber() ? nativeCount.asLong() : preCount;
    }

    /** {@code id in ["a","b"]} with each id JSON-quoted. */
    static String inFilter(List<String> ids) {
        StringBuilder sb = new StringBuilder("id in [");
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(JsonHttpClient.toJson(ids.get(i)));
        }
        return sb.append(']').toString();
    }

    @Override
    public void dropCollection(String name) throws AdapterException {
        ensureConnected();
        if (!exists(name)) return;
        call(v1() ? "/v1/vector/collections/drop" : "/v2/vectordb/collections/drop", body(name), "drop collection");
    }
}
