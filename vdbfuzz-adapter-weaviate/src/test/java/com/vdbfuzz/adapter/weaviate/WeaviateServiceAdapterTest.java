package com.vdbfuzz.adapter.weaviate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vdbfuzz.adapter.AdapterOptions;
import com.vdbfuzz.adapter.IdCodec;
import com.vdbfuzz.adapter.ServiceErrorException;
import com.vdbfuzz.adapter.http.HttpReply;
import com.vdbfuzz.adapter.http.StubHttpServer;
import com.vdbfuzz.config.ServiceConfig;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.SearchHit;
import com.vdbfuzz.model.Vector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeaviateServiceAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StubHttpServer server;
    private WeaviateServiceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
        server.on("GET", "/v1/.well-known/ready", 200, "");
        adapter = new WeaviateServiceAdapter(ServiceConfig.defaults("weaviate").withEndpoint("127.0.0.1", server.port()),
                new AdapterOptions(Duration.ofSeconds(5), Duration.ofSeconds(1), Metric.L2));
    }

    @AfterEach
    void tearDown() {
        adapter.close();
        server.close();
    }

    private JsonNode lastBody() throws Exception {
        return MAPPER.readTree(server.bodies.get(server.bodies.size() - 1));
    }

    @Test
    void ensureCollection_createsClassWithoutVectorizer() throws Exception {
        server.on("GET", "/v1/schema/Test_collection", 404, "")
                .on("POST", "/v1/schema", 200, "{\"class\":\"Test_collection\"}");

        adapter.ensureCollection("test_collection", 4);

        JsonNode body = lastBody();
        assertEquals("Test_collection", body.path("class").asText());
        assertEquals("none", body.path("vectorizer").asText());
        assertEquals("l2-squared", body.path("vectorIndexConfig").path("distance").asText());
    }

    @Test
    void ensureCollection_alreadyExistsIsSuccess() {
        server.on("GET", "/v1/schema/TestCollection", 404, "")
                .on("POST", "/v1/schema", 422, "{\"error\":[{\"message\":\"class name \\\"TestCollection\\\" already exists\"}]}");

        assertDoesNotThrow(() -> adapter.ensureCollection("TestCollection", 4));
    }

    @Test
    void insert_countsOnlyObjectsWithoutErrors() throws Exception {
        server.on("POST", "/v1/batch/objects", 200, "["
                + "{\"id\":\"" + IdCodec.toUuid("a") + "\",\"properties\":{\"sourceId\":\"a\"},\"result\":{}},"
                + "{\"id\":\"" + IdCodec.toUuid("b") + "\",\"properties\":{\"sourceId\":\"b\"},"
                + "\"result\":{\"errors\":{\"error\":[{\"message\":\"vector lengths don't match\"}]}}}]");

        List<String> stored = adapter.insert("TestCollection", List.of(Vector.of(1f, 2f), Vector.of(1f)),
                List.of("a", "b"), List.of());

        assertEquals(List.of("a"), stored);
        JsonNode first = lastBody().path("objects").get(0);
        assertEquals(IdCodec.toUuid("a"), first.path("id").asText());
        assertEquals("a", first.path("properties").path("sourceId").asText());
    }

    @Test
    void search_mapsSourceIdsFromGraphql() throws Exception {
        server.on("POST", "/v1/graphql", 200, "{\"data\":{\"Get\":{\"TestCollection\":["
                + "{\"sourceId\":\"a\",\"_additional\":{\"id\":\"u1\",\"distance\":0.0}},"
                + "{\"sourceId\":\"b\",\"_additional\":{\"id\":\"u2\",\"distance\":0.7}}]}}}");

        List<SearchHit> hits = adapter.search("TestCollection", Vector.of(1f, 0.5f), 2, Metric.L2);

        assertEquals(List.of(new SearchHit("a", 0.0), new SearchHit("b", 0.7)), hits);
        String query = lastBody().path("query").asText();
        assertTrue(query.contains("TestCollection(nearVector: {vector: [1.0,0.5]}, limit: 2)"));
    }

    @Test
    void search_graphqlErrorsAreServiceErrors() {
        server.on("POST", "/v1/graphql", 200,
                "{\"data\":{\"Get\":{\"TestCollection\":null}},\"errors\":[{\"message\":\"vector lengths don't match\"}]}");

        ServiceErrorException e = assertThrows(ServiceErrorException.class,
                () -> adapter.search("TestCollection", Vector.of(1f), 2, Metric.L2));
        assertTrue(e.getMessage().contains("vector lengths don't match"));
    }

    @Test
    void delete_returnsSuccessfulCount() throws Exception {
        server.on("DELETE", "/v1/batch/objects", 200,
                "{\"match\":{},\"output\":\"minimal\",\"results\":{\"failed\":0,\"matches\":1,\"successful\":1}}");

        assertEquals(1, adapter.delete("TestCollection", List.of("a", "nonexistent_id")));
        JsonNode where = lastBody().path("match").path("where");
        assertEquals("ContainsAny", where.path("operator").asText());
        assertEquals(2, where.path("valueTextArray").size());
    }

    @Test
    void className_capitalisesFirstCharacter() {
        assertEquals("Test_collection", WeaviateServiceAdapter.className("test_collection"));
        assertEquals("123", WeaviateServiceAdapter.className("123"));
        assertEquals("", WeaviateServiceAdapter.className(""));
    }

    @Test
    void versionOf_readsMetaVersion() {
        assertEquals("1.24.1", WeaviateServiceAdapter.versionOf(new HttpReply("GET", "/v1/meta", 200,
                "{\n  \"hostname\": \"http://[::]:8080\",\n  \"version\" : \"1.24.1\"\n}")));
        assertNull(WeaviateServiceAdapter.versionOf(new HttpReply("GET", "/v1/meta", 200, "{\"modules\":{}}")));
    }
}
