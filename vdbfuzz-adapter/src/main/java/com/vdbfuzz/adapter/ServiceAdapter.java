package com.vdbfuzz.adapter;

import com.vdbfuzz.config.ServiceConfig;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.SearchHit;
import com.vdbfuzz.model.Vector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Uniform capability contract over one vector database service. Implementations translate each
 * call into the service's native protocol and never pre-validate inputs: whatever the service
 * accepts, rejects or coerces is the outcome. Service-side errors keep their native payload.
 * <p>
 * Each adapter owns its transport; instances are not shared between services.
 */
public interface ServiceAdapter extends AutoCloseable {

    /** Service name as configured (e.g. "qdrant"). */
    String getServiceName();

    ServiceConfig getConfig();

    /** Collection targeted when a test case carries no override. */
    default String defaultCollection() {
        return getConfig().getCollection();
    }

    /**
     * Establishes the session. Idempotent.
     *
     * @throws ConnectionFailureException on network refusal or authentication failure
     */
    void connect() throws AdapterException;

    /** Creates the collection with the given dimension if absent; "already exists" is success. */
    void ensureCollection(String name, int dimension) throws AdapterException;

    /**
     * Stores vectors with their ids and optional metadata ({@code metadata} may be empty or contain
     * null entries).
     *
     * @return ids the service reports as stored
     */
    List<String> insert(String collection, List<Vector> vectors, List<String> ids,
                        List<Map<String, Object>> metadata) throws AdapterException;

    /**
     * Nearest-neighbour search.
     *
     * @return at most {@code k} hits, best first, with the caller's ids
     * @throws UnsupportedMetricException when the service cannot use {@code metric} for this collection
     */
    List<SearchHit> search(String collection, Vector query, int k, Metric metric) throws AdapterException;

    /**
     * One ranked list per query, in query order. The default issues one search per query;
     * adapters with a native batch endpoint override it.
     */
    default List<List<SearchHit>> batchSearch(String collection, List<Vector> queries, int k, Metric metric)
            throws AdapterException {
        List<List<SearchHit>> out = new ArrayList<>(queries.size());
        for (Vector q : queries) {
            out.add(search(collection, q, k, metric));
        }
        return out;
    }

    /** @return number of entries removed; 0 for ids that did not exist unless the service refuses them */
    long delete(String collection, List<String> ids) throws AdapterException;

    /** Removes the collection; a missing collection is not an error. */
    void dropCollection(String name) throws AdapterException;

    /** Probes the service's ranked health endpoints. Never throws. */
    HealthStatus healthCheck();

    @Override
    void close();
}
