package com.vdbfuzz.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestResultTest {

    private static TestResult sample() {
        TestCase tc = new TestCase(7, Operation.INSERT, null,
                new InsertParams(
                        List.of(Vector.of(0.5f, Float.NaN, Float.POSITIVE_INFINITY)),
                        List.of("id_7"),
                        Arrays.asList((Map<String, Object>) null)));
        DatabaseResult ok = DatabaseResult.success("milvus", new InsertData(List.of("id_7")), 1_000L);
        DatabaseResult failed = DatabaseResult.failure("qdrant",
                new ResultError(ErrorKind.SERVICE, "Qdrant insert failed", 400, "{\"status\":{\"error\":\"NaN\"}}"), 2_000L);
        Inconsistency inc = new Inconsistency(InconsistencyKind.ERROR_DIVERGENT, DivergenceRule.SUCCESS,
                List.of("milvus", "qdrant"), "succeeded: [milvus]; failed: [qdrant]");
        return new TestResult(tc, List.of(ok, failed), List.of("chroma"), List.of(inc));
    }

    @Test
    void toJson_writesVersionedRecordInFixedOrder() throws Exception {
        String json = sample().toJson();
        JsonNode node = new ObjectMapper().readTree(json);

        assertEquals(TestResult.SCHEMA_VERSION, node.get("schemaVersion").asInt());
        assertTrue(json.indexOf("\"schemaVersion\"") < json.indexOf("\"testCase\""));
        assertTrue(json.indexOf("\"results\"") < json.indexOf("\"inconsistencies\""));
        assertEquals("insert", node.get("testCase").get("operation").asText());
        assertEquals("NaN", node.get("testCase").get("params").get("vectors").get(0).get(1).asText());
        assertEquals("error-divergent", node.get("inconsistencies").get(0).get("kind").asText());
        assertEquals("high", node.get("inconsistencies").get(0).get("severity").asText());
        assertEquals("{\"status\":{\"error\":\"NaN\"}}", node.get("results").get(1).get("error").get("body").asText());
    }

    @Test
    void fromJson_readsBackPersistedRecord() {
        TestResult original = sample();

        TestResult read = TestResult.fromJson(original.toJson());

        assertEquals(original, read);
        assertTrue(((InsertParams) read.getTestCase().getParams()).getVectors().get(0).hasNonFinite());
    }

    @Test
    void maxSeverity_nullWithoutInconsistencies() {
        TestResult r = new TestResult(sample().getTestCase(), List.of(), List.of(), List.of());

        assertFalse(r.hasInconsistencies());
        assertNull(r.maxSeverity());
        assertEquals(Severity.HIGH, sample().maxSeverity());
    }

    @Test
    void result_looksUpByServiceName() {
        TestResult r = sample();

        assertTrue(r.result("milvus").isSuccess());
        assertFalse(r.result("qdrant").isSuccess());
        assertNull(r.result("weaviate"));
    }
}
