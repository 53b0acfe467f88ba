package com.vdbfuzz.adapter.weaviate;

import com.fasterxml.jackson.databind.JsonNode;
import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.IdCodec;
import com.vdbfuzz.adapter.ServiceErrorException;
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

/**
 * Weaviate over REST for schema and batch writes and GraphQL for search (default
 * http://localhost:8080). Collections are classes, whose names must start upper-case. Object ids
 * must be UUIDs; the caller id is stored in the text property {@value #SOURCE_ID}.
 */
public final class WeaviateServiceAdapter extends AbstractHttpServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(WeaviateServiceAdapter.class);

    static final String SOURCE_ID = "sourceId";

    public WeaviateServiceAdapter(ServiceConfig config, AdapterOptions options) {
        super(config, options, healthProbe(config.getName()), authHeaders(config));
    }

    static HealthProbe healthProbe(String service) {
        return new HealthProbe(service, List.of(
                HealthProbe.get("/v1/.well-known/ready"),
                HealthProbe.get("/.well-known/ready"),
                HealthProbe.get("/v1/meta").version(WeaviateServiceAdapter::versionOf)));
    }

    static String versionOf(HttpReply reply) {
        JsonNode version = reply.bodyTree().path("version");
        return version.isTextual() ? version.asText() : null;
    }

    private static Map<String, String> authHeaders(ServiceConfig config) {
        return hasText(config.getPassword()) ? Map.of("Authorization", "Bearer " + config.getPassword()) : Map.of();
    }

    static String distanceName(Metric metric) {
        return switch (metric) {
            case L2 -> "l2-squared";
            case COSINE -> "cosine";
            case INNER_PRODUCT -> "dot";
        };
    }

    /** Class name for a collection: first character upper-cased, the rest verbatim. */
    static String className(String collection) {
        if (collection == null || collection.isEmpty()) return "";
        return Character.toUpperCase(collection.charAt(0)) + collection.substring(1);
    }

    @Override
    public void ensureCollection(String name, int dimension) throws AdapterException {
        ensureConnected();
        String cls = className(name);
        HttpReply existing = http.get("/v1/schema/" + JsonHttpClient.segment(cls));
        if (existing.isSuccess()) return;
        if (existing.getStatus() != 404) {
            http.requireSuccess(existing, "get class");
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("class", cls);
        schema.put("vectorizer", "none");
        schema.put("vectorIndexConfig", Map.of("distance", distanceName(options.getCollectionMetric())));
        schema.put("properties", List.of(Map.of("name", SOURCE_ID, "dataType", List.of("text"))));
        HttpReply created = http.post("/v1/schema", schema);
        if (created.getStatus() == 422 && created.getBody().contains("already exists")) return;
        http.requireSuccess(created, "create class");
        log.info("Collection ready | service={} | class={} | distance={}",
                getServiceName(), cls, distanceName(options.getCollectionMetric()));
    }

    @Override
    public List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                               List<Map<String, Object>> metadata) throws AdapterException {
        ensureConnected();
        String cls = className(collection);
        List<Map<String, Object>> objects = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            String id = i < ids.size() ? ids.get(i) : null;
            Map<String, Object> properties = new LinkedHashMap<>();
            Map<String, Object> m = metadata != null && i < metadata.size() ? metadata.get(i) : null;
            if (m != null) properties.putAll(m);
            properties.put(SOURCE_ID, id);
            Map<String, Object> object = new LinkedHashMap<>();
            object.put("class", cls);
            object.put("id", IdCodec.toUuid(id));
            object.put("vector", vectors.get(i));
            object.put("properties", properties);
            objects.add(object);
        }
        HttpReply reply = http.requireSuccess(http.post("/v1/batch/objects", Map.of("objects", objects)), "batch insert");
        JsonNode results = http.parse(reply, "batch insert");
        if (!results.isArray()) {
            throw http.protocolViolation(reply, "batch insert", "response is not an array");
        }
        List<String> stored = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (JsonNode object : results) {
            JsonNode objectErrors = object.path("result").path("errors");
            if (objectErrors.isMissingNode() || objectErrors.isNull()) {
                stored.add(object.path("properties").path(SOURCE_ID).asText());
            } else {
                errors.add(objectErrors.toString());
            }
        }
        if (stored.isEmpty() && !errors.isEmpty()) {
            throw new ServiceErrorException(getServiceName(),
                    getServiceName() + " batch insert rejected every object: " + errors.get(0),
                    reply.getStatus(), reply.getBody());
        }
        return stored;
    }

    @Override
    public List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException {
        ensureConnected();
        if (metric != options.getCollectionMetric()) {
            throw new UnsupportedMetricException(getServiceName(), metric,
                    "distance is fixed in the class vectorIndexConfig (" + distanceName(options.getCollectionMetric()) + ")");
        }
        String cls = className(collection);
        String graphql = "{ Get { " + cls + "(nearVector: {vector: " + vectorLiteral(query) + "}, limit: " + k
                + ") { " + SOURCE_ID + " _additional { id distance } } } }";
        HttpReply reply = http.requireSuccess(http.post("/v1/graphql", Map.of("query", graphql)), "graphql search");
        JsonNode root = http.parse(reply, "graphql search");
        JsonNode errors = root.get("errors");
        if (errors != null && errors.isArray() && errors.size() > 0) {
            throw new ServiceErrorException(getServiceName(),
                    getServiceName() + " search failed: " + errors.get(0).path("message").asText(),
                    reply.getStatus(), reply.getBody());
        }
        JsonNode objects = root.path("data").path("Get").get(cls);
        if (objects == null || !objects.isArray()) {
            throw http.protocolViolation(reply, "graphql search", "missing data.Get." + cls);
        }
        List<SearchHit> hits = new ArrayList<>(objects.size());
        for (JsonNode o : objects) {
            JsonNode source = o.get(SOURCE_ID);
            String id = source != null && !source.isNull() ? source.asText() : o.path("_additional").path("id").asText();
            hits.add(new SearchHit(id, o.path("_additional").path("distance").asDouble()));
        }
        return hits;
    }

    /** GraphQL list literal; non-finite components are written as-is and left for the service to reject. */
    static String vectorLiteral(Vector v) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < v.dimension(); i++) {
            if (i > 0) sb.append(',');
            sb.append(v.get(i));
        }
        return sb.append(']').toString();
    }

    @Override
    public long delete(String collection, List<String> ids) throws AdapterException {
        ensureConnected();
        List<String> uuids = new ArrayList<>(ids.size());
        for (String id : ids) uuids.add(IdCodec.toUuid(id));
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("path", List.of("id"));
        where.put("operator", "ContainsAny");
        where.put("valueTextArray", uuids);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("match", Map.of("class", className(collection), "where", where));
        body.put("output", "minimal");
        HttpReply reply = http.requireSuccess(http.delete("/v1/batch/objects", body), "batch delete");
        JsonNode successful = http.parse(reply, "batch delete").path("results").get("successful");
        if (successful == null || !successful.isNumber()) {
            throw http.protocolViolation(reply, "batch delete", "missing results.successful");
        }
        return successful.asLong();
    }

    @Override
    public void dropCollection(String name) throws AdapterException {
        ensureConnected();
        HttpReply reply = http.delete("/v1/schema/" + JsonHttpClient.segment(className(name)), null);
        if (reply.getStatus() == 404) return;
        http.requireSuccess(reply, "delete class");
    }
}
