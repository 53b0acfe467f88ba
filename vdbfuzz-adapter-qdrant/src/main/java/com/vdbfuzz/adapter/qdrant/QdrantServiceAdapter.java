package com.vdbfuzz.adapter.qdrant;

import com.fasterxml.jackson.databind.JsonNode;
import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.IdCodec;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Qdrant over its REST API (default http://localhost:6333). Point ids must be unsigned integers or
 * UUIDs, so caller ids are mapped with {@link IdCodec} and kept in the payload field
 * {@value IdCodec#ORIGINAL_ID_FIELD}.
 */
public final class QdrantServiceAdapter extends AbstractHttpServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(QdrantServiceAdapter.class);

    private static final String RESULT = "result";

    public QdrantServiceAdapter(ServiceConfig config, AdapterOptions options) {
        super(config, options, healthProbe(config.getName()), authHeaders(config));
    }

    static HealthProbe healthProbe(String service) {
        return new HealthProbe(service, List.of(
                HealthProbe.get("/healthz"),
                HealthProbe.get("/").readyWhen(r -> r.isSuccess() && r.getBody().contains("version"))
                        .version(QdrantServiceAdapter::versionOf),
                HealthProbe.get("/collections")));
    }

    static String versionOf(HttpReply reply) {
        JsonNode version = reply.bodyTree().path("version");
        return version.isTextual() ? version.asText() : null;
    }

    private static Map<String, String> authHeaders(ServiceConfig config) {
        return hasText(config.getPassword()) ? Map.of("api-key", config.getPassword()) : Map.of();
    }

    static String distanceName(Metric metric) {
        return switch (metric) {
            case L2 -> "Euclid";
            case COSINE -> "Cosine";
            case INNER_PRODUCT -> "Dot";
        };
    }

    private static String collectionPath(String collection) {
        return "/collections/" + JsonHttpClient.segment(collection);
    }

    @Override
    public void ensureCollection(String name, int dimension) throws AdapterException {
        ensureConnected();
        HttpReply existing = http.get(collectionPath(name));
        if (existing.isSuccess()) return;
        if (existing.getStatus() != 404) {
            http.requireSuccess(existing, "get collection");
        }
        String distance = distanceName(options.getCollectionMetric());
        HttpReply created = http.put(collectionPath(name),
                Map.of("vectors", Map.of("size", dimension, "distance", distance)));
        if (created.isSuccess() || created.getStatus() == 409 || created.getBody().contains("already exists")) {
            log.info("Collection ready | service={} | collection={} | dimension={} | distance={}",
                    getServiceName(), name, dimension, distance);
            return;
        }
        if (created.getStatus() == 400 || created.getStatus() == 422) {
            // pre-0.10 servers only accept the flat form
            HttpReply legacy = http.put(collectionPath(name), Map.of("vector_size", dimension, "distance", distance));
            if (legacy.isSuccess()) return;
        }
        http.requireSuccess(created, "create collection");
    }

    @Override
    public List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                               List<Map<String, Object>> metadata) throws AdapterException {
        ensureConnected();
        List<Map<String, Object>> points = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            String id = i < ids.size() ? ids.get(i) : null;
            Map<String, Object> payload = new LinkedHashMap<>();
            Map<String, Object> m = metadata != null && i < metadata.size() ? metadata.get(i) : null;
            if (m != null) payload.putAll(m);
            payload.put(IdCodec.ORIGINAL_ID_FIELD, id);
            Map<String, Object> point = new HashMap<>();
            point.put("id", IdCodec.toUuid(id));
            point.put("vector", vectors.get(i));
            point.put("payload", payload);
            points.add(point);
        }
        HttpReply reply = http.requireSuccess(
                http.put(collectionPath(collection) + "/points?wait=true", Map.of("points", points)), "upsert");
        JsonNode root = http.parse(reply, "upsert");
        if (!root.has(RESULT)) {
            throw http.protocolViolation(reply, "upsert", "missing 'result'");
        }
        return new ArrayList<>(ids.subList(0, Math.min(ids.size(), vectors.size())));
    }

    @Override
    public List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException {
        ensureConnected();
        requireCollectionMetric(metric);
        HttpReply reply = http.requireSuccess(
                http.post(collectionPath(collection) + "/points/search", searchBody(query, k)), "search");
        JsonNode result = http.parse(reply, "search").get(RESULT);
        if (result == null || !result.isArray()) {
            throw http.protocolViolation(reply, "search", "'result' is not an array");
        }
        return hits(result, reply);
    }

    @Override
    public List<List<SearchHit>> batchSearch(String collection, List<Vector> queries, int k, Metric metric)
            throws AdapterException {
        ensureConnected();
        requireCollectionMetric(metric);
        List<Map<String, Object>> searches = new ArrayList<>(queries.size());
        for (Vector q : queries) searches.add(searchBody(q, k));
        HttpReply reply = http.requireSuccess(
                http.post(collectionPath(collection) + "/points/search/batch", Map.of("searches", searches)),
                "batch search");
        JsonNode result = http.parse(reply, "batch search").get(RESULT);
        if (result == null || !result.isArray()) {
            throw http.protocolViolation(reply, "batch search", "'result' is not an array");
        }
        List<List<SearchHit>> out = new ArrayList<>(result.size());
        for (JsonNode perQuery : result) {
            out.add(hits(perQuery, reply));
        }
        return out;
    }

    private static Map<String, Object> searchBody(Vector query, int k) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", query);
        body.put("limit", k);
        body.put("with_payload", List.of(IdCodec.ORIGINAL_ID_FIELD));
        return body;
    }

    private List<SearchHit> hits(JsonNode array, HttpReply reply) throws AdapterException {
        if (!array.isArray()) {
            throw http.protocolViolation(reply, "search", "hit list is not an array");
        }
        List<SearchHit> out = new ArrayList<>(array.size());
        for (JsonNode point : array) {
            JsonNode original = point.path("payload").get(IdCodec.ORIGINAL_ID_FIELD);
            String id = original != null && !original.isNull() ? original.asText() : point.path("id").asText();
            out.add(new SearchHit(id, point.path("score").asDouble()));
        }
        return out;
    }

    private void requireCollectionMetric(Metric metric) throws UnsupportedMetricException {
        if (metric != options.getCollectionMetric()) {
            throw new UnsupportedMetricException(getServiceName(), metric,
                    "distance is fixed at collection creation (" + distanceName(options.getCollectionMetric()) + ")");
        }
    }

    @Override
    public long delete(String collection, List<String> ids) throws AdapterException {
        ensureConnected();
        List<String> uuids = new ArrayList<>(ids.size());
        for (String id : ids) uuids.add(IdCodec.toUuid(id));
        Map<String, Object> lookup = new LinkedHashMap<>();
        lookup.put("ids", uuids);
        lookup.put("with_payload", false);
        lookup.put("with_vector", false);
        HttpReply found = http.requireSuccess(http.post(collectionPath(collection) + "/points", lookup), "retrieve");
        JsonNode existing = http.parse(found, "retrieve").get(RESULT);
        if (existing == null || !existing.isArray()) {
            throw http.protocolViolation(found, "retrieve", "'result' is not an array");
        }
        http.requireSuccess(
                http.post(collectionPath(collection) + "/points/delete?wait=true", Map.of("points", uuids)), "delete");
        return existing.size();
    }

    @Override
    public void dropCollection(String name) throws AdapterException {
        ensureConnected();
        HttpReply reply = http.delete(collectionPath(name), null);
        if (reply.getStatus() == 404) return;
        http.requireSuccess(reply, "drop collection");
    }
}
