package com.vdbfuzz.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DatabaseResultTest {

    @Test
    void constructor_rejectsSuccessWithError() {
        ResultError err = ResultError.of(ErrorKind.TIMEOUT, "deadline exceeded");
        assertThrows(IllegalArgumentException.class, () -> new DatabaseResult("chroma", true, null, err, 0));
    }

    @Test
    void constructor_rejectsFailureWithoutError() {
        assertThrows(IllegalArgumentException.class, () -> new DatabaseResult("chroma", false, null, null, 0));
    }

    @Test
    void insertData_countsDistinctIds() {
        InsertData data = new InsertData(List.of("a", "b", "a"));
        assertEquals(3, data.getStoredIds().size());
        assertEquals(2, data.distinctCount());
    }

    @Test
    void testCase_rejectsParamsOfAnotherOperation() {
        assertThrows(IllegalArgumentException.class,
                () -> new TestCase(1, Operation.SEARCH, null, new DeleteParams(List.of("x"))));
    }

    @Test
    void operationAndMetric_acceptAliases() {
        assertEquals(Operation.MIXED, Operation.fromWireName("mixed_operations"));
        assertEquals(Operation.BATCH_SEARCH, Operation.fromWireName("BATCH_SEARCH"));
        assertEquals(Metric.INNER_PRODUCT, Metric.fromWireName("ip"));
        assertThrows(IllegalArgumentException.class, () -> Metric.fromWireName("hamming"));
    }
}
