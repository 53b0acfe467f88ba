package com.vdbfuzz.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for one service under test. {@code name} selects the adapter
 * (milvus, chroma, qdrant, weaviate); unset fields fall back to that service's defaults.
 */
public final class ServiceConfig {

    /** name → {port, collection, database} */
    private static final Map<String, String[]> DEFAULTS = Map.of(
            "milvus", new String[]{"19530", "test_collection", "default"},
            "chroma", new String[]{"8000", "test_collection", "default_database"},
            "qdrant", new String[]{"6333", "test_collection", null},
            "weaviate", new String[]{"8080", "TestCollection", null}
    );

    private final String name;
    private final String scheme;
    private final String host;
    private final int port;
    private final String collection;
    private final String database;
    private final String username;
    private final String password;
    private final boolean enabled;

    @JsonCreator
    public ServiceConfig(
            @JsonProperty("name") String name,
            @JsonProperty("scheme") String scheme,
            @JsonProperty("host") String host,
            @JsonProperty("port") Integer port,
            @JsonProperty("collection") String collection,
            @JsonProperty("database") String database,
            @JsonProperty("username") String username,
            @JsonProperty("password") String password,
            @JsonProperty("enabled") Boolean enabled) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Service name must be non-blank");
        }
        this.name = name.trim().toLowerCase(Locale.ROOT);
        String[] d = DEFAULTS.getOrDefault(this.name, new String[]{null, "test_collection", null});
        this.scheme = scheme != null && !scheme.isBlank() ? scheme.trim() : "http";
        this.host = host != null && !host.isBlank() ? host.trim() : "localhost";
        this.port = port != null ? port : (d[0] != null ? Integer.parseInt(d[0]) : 0);
        this.collection = collection != null ? collection : d[1];
        this.database = database != null ? database : d[2];
        this.username = username;
        this.password = password;
        this.enabled = enabled == null || enabled;
    }

    /** Settings for a known service with all defaults (localhost, default port and collection). */
    public static ServiceConfig defaults(String name) {
        return new ServiceConfig(name, null, null, null, null, null, null, null, null);
    }

    /** Returns a copy pointing at another host and port (tests, port-forwarded services). */
    public ServiceConfig withEndpoint(String host, int port) {
        return new ServiceConfig(name, scheme, host, port, collection, database, username, password, enabled);
    }

    /** Whether defaults exist for this name, i.e. a built-in adapter is expected. */
    @JsonIgnore
    public boolean isKnownService() {
        return DEFAULTS.containsKey(name);
    }

    public String getName() {
        return name;
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** Collection (or class) this service's test cases target unless a test case overrides it. */
    public String getCollection() {
        return collection;
    }

    /** Database / namespace where the service has one (milvus database, chroma database); may be null. */
    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    @JsonIgnore
    public String getPassword() {
        return password;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** e.g. {@code http://localhost:6333} */
    @JsonIgnore
    public String getBaseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceConfig that = (ServiceConfig) o;
        return port == that.port && enabled == that.enabled && name.equals(that.name)
                && scheme.equals(that.scheme) && host.equals(that.host)
                && Objects.equals(collection, that.collection) && Objects.equals(database, that.database)
                && Objects.equals(username, that.username) && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scheme, host, port, collection, database, username, password, enabled);
    }

    @Override
    public String toString() {
        return name + "@" + getBaseUrl() + "/" + collection;
    }
}
