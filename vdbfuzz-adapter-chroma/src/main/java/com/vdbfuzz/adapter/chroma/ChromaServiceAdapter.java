package com.vdbfuzz.adapter.chroma;

import com.fasterxml.jackson.databind.JsonNode;
import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.UnsupportedMetricException;
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
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chroma over its HTTP API (default http://localhost:8000). Collections are addressed by id on the
 * data path; the adapter resolves and caches name → id. The distance function is the collection's
 * {@code hnsw:space}, fixed at creation.
 */
public final class ChromaServiceAdapter extends AbstractHttpServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(ChromaServiceAdapter.class);

    static final String V2 = "v2";
    static final String V1 = "v1";
    private static final String TENANT = "default_tenant";

    private final Map<String, String> collectionIds = new ConcurrentHashMap<>();

    public ChromaServiceAdapter(ServiceConfig config, AdapterOptions options) {
        super(config, options, healthProbe(config.getName()), authHeaders(config));
    }

    static HealthProbe healthProbe(String service) {
        return new HealthProbe(service, List.of(
                HealthProbe.get("/api/v2/heartbeat").dialect(V2),
                HealthProbe.get("/api/v1/heartbeat").dialect(V1),
                HealthProbe.get("/api/v2/version").dialect(V2).version(r -> r.getBody().replace("\"", "").trim())));
    }

    private static Map<String, String> authHeaders(ServiceConfig config) {
        return hasText(config.getPassword()) ? Map.of("X-Chroma-Token", config.getPassword()) : Map.of();
    }

    static String spaceName(Metric metric) {
        return switch (metric) {
            case L2 -> "l2";
            case COSINE -> "cosine";
            case INNER_PRODUCT -> "ip";
        };
    }

    private String base() {
        if (V1.equals(dialect())) return "/api/v1";
        String db = hasText(config.getDatabase()) ? config.getDatabase() : "default_database";
        return "/api/v2/tenants/" + TENANT + "/databases/" + JsonHttpClient.segment(db);
    }

    @Override
    public void ensureCollection(String name, int dimension) throws AdapterException {
        ensureConnected();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("metadata", Map.of("hnsw:space", spaceName(options.getCollectionMetric())));
        body.put("get_or_create", true);
        HttpReply reply = http.requireSuccess(http.post(base() + "/collections", body), "create collection");
        JsonNode id = http.parse(reply, "create collection").get("id");
        if (id == null || !id.isTextual()) {
            throw http.protocolViolation(reply, "create collection", "missing collection 'id'");
        }
        collectionIds.put(name, id.asText());
        log.info("Collection ready | service={} | collection={} | id={} | space={}",
                getServiceName(), name, id.asText(), spaceName(options.getCollectionMetric()));
    }

    private String collectionId(String name) throws AdapterException {
        String cached = collectionIds.get(name);
        if (cached != null) return cached;
        HttpReply reply = http.requireSuccess(http.get(base() + "/collections/" + JsonHttpClient.segment(name)),
                "get collection");
        JsonNode id = http.parse(reply, "get collection").get("id");
        if (id == null || !id.isTextual()) {
            throw http.protocolViolation(reply, "get collection", "missing collection 'id'");
        }
        collectionIds.put(name, id.asText());
        return id.asText();
    }

    private String collectionPath(String name) throws AdapterException {
        return base() + "/collections/" + JsonHttpClient.segment(collectionId(name));
    }

    @Override
    public List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                               List<Map<String, Object>> metadata) throws AdapterException {
        ensureConnected();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", ids);
        body.put("embeddings", vectors);
        if (metadata != null && !metadata.isEmpty()) body.put("metadatas", metadata);
        http.requireSuccess(http.post(collectionPath(collection) + "/add", body), "add");
        return new ArrayList<>(ids);
    }

    @Override
    public List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException {
        List<List<SearchHit>> perQuery = batchSearch(collection, List.of(query), k, metric);
        return perQuery.isEmpty() ? List.of() : perQuery.get(0);
    }

    @Override
    public List<List<SearchHit>> batchSearch(String collection, List<Vector> queries, int k, Metric metric)
            throws AdapterException {
        ensureConnected();
        if (metric != options.getCollectionMetric()) {
            throw new UnsupportedMetricException(getServiceName(), metric,
                    "hnsw:space is fixed at collection creation (" + spaceName(options.getCollectionMetric()) + ")");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query_embeddings", queries);
        body.put("n_results", k);
        body.put("include", List.of("distances"));
        HttpReply reply = http.requireSuccess(http.post(collectionPath(collection) + "/query", body), "query");
        JsonNode root = http.parse(reply, "query");
        JsonNode ids = root.get("ids");
        JsonNode distances = root.get("distances");
        if (ids == null || !ids.isArray()) {
            throw http.protocolViolation(reply, "query", "missing 'ids'");
        }
        List<List<SearchHit>> out = new ArrayList<>(ids.size());
        for (int q = 0; q < ids.size(); q++) {
            JsonNode qIds = ids.get(q);
            JsonNode qDist = distances != null && distances.isArray() ? distances.get(q) : null;
            List<SearchHit> hits = new ArrayList<>(qIds.size());
            for (int i = 0; i < qIds.size(); i++) {
                double d = qDist != null && qDist.has(i) ? qDist.get(i).asDouble() : Double.NaN;
                hits.add(new SearchHit(qIds.get(i).asText(), d));
            }
            out.add(hits);
        }
        return out;
    }

    @Override
    public long delete(String collection, List<String> ids) throws AdapterException {
        ensureConnected();
        String path = collectionPath(collection);
        Map<String, Object> lookup = new LinkedHashMap<>();
        lookup.put("ids", ids);
        lookup.put("include", List.of());
        HttpReply found = http.requireSuccess(http.post(path + "/get", lookup), "get");
        JsonNode existing = http.parse(found, "get").get("ids");
        if (existing == null || !existing.isArray()) {
            throw http.protocolViolation(found, "get", "missing 'ids'");
        }
        http.requireSuccess(http.post(path + "/delete", Map.of("ids", ids)), "delete");
        return existing.size();
    }

    @Override
    public void dropCollection(String name) throws AdapterException {
        ensureConnected();
        collectionIds.remove(name);
        HttpReply reply = http.delete(base() + "/collections/" + JsonHttpClient.segment(name), null);
        if (reply.getStatus() == 404 || reply.getBody().contains("does not exist")) return;
        http.requireSuccess(reply, "delete collection");
    }

    @Override
    protected void resetConnection() {
        super.resetConnection();
        collectionIds.clear();
    }
}
