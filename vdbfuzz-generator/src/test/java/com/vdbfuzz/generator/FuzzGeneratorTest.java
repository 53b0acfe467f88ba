package com.vdbfuzz.generator;

import com.vdbfuzz.config.ConfigurationException;
import com.vdbfuzz.config.FuzzSettings;
import com.vdbfuzz.model.DeleteParams;
import com.vdbfuzz.model.InsertParams;
import com.vdbfuzz.model.MixedParams;
import com.vdbfuzz.model.MixedStep;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.SearchParams;
import com.vdbfuzz.model.TestCase;
import com.vdbfuzz.model.Vector;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FuzzGeneratorTest {

    private static FuzzSettings.Builder seeded(long seed) {
        return FuzzSettings.builder().seed(seed).vectorDimension(8);
    }

    @Test
    void generate_sameSeedSameSequence() {
        List<TestCase> a = new FuzzGenerator(seeded(42L).build()).generate(200);
        List<TestCase> b = new FuzzGenerator(seeded(42L).build()).generate(200);

        assertEquals(a, b);
    }

    @Test
    void generate_differentSeedsDiffer() {
        List<TestCase> a = new FuzzGenerator(seeded(1L).build()).generate(50);
        List<TestCase> b = new FuzzGenerator(seeded(2L).build()).generate(50);

        assertNotEquals(a, b);
    }

    @Test
    void generate_testIdsIncreaseFromOne() {
        List<TestCase> cases = new FuzzGenerator(seeded(3L).build()).generate(10);

        for (int i = 0; i < cases.size(); i++) {
            assertEquals(i + 1, cases.get(i).getId());
        }
    }

    @Test
    void generate_coversEveryOperationAndEdgeShapeOver1000Cases() {
        FuzzSettings settings = seeded(7L)
                .probabilityEmptyVector(0.05)
                .probabilityOversizedVector(0.05)
                .probabilityEdgeComponent(0.01)
                .probabilityCollectionOverride(0.05)
                .build();
        List<TestCase> cases = new FuzzGenerator(settings).generate(1000);

        Set<Operation> seen = EnumSet.noneOf(Operation.class);
        boolean empty = false, oversized = false, nonFinite = false, override = false, emptyId = false;
        for (TestCase tc : cases) {
            seen.add(tc.getOperation());
            override |= tc.getCollection() != null;
            for (Vector v : vectorsOf(tc)) {
                empty |= v.isEmpty();
                oversized |= v.dimension() > settings.getMaxDimension();
                nonFinite |= v.hasNonFinite();
            }
            if (tc.getParams() instanceof InsertParams p) {
                emptyId |= p.getIds().contains("");
            }
            if (tc.getParams() instanceof DeleteParams p) {
                emptyId |= p.getIds().contains("");
            }
        }
        assertEquals(EnumSet.allOf(Operation.class), seen);
        assertTrue(empty, "empty vector");
        assertTrue(oversized, "oversized vector");
        assertTrue(nonFinite, "NaN or infinite component");
        assertTrue(override, "collection override");
        assertTrue(emptyId, "empty id");
    }

    @Test
    void next_zeroWeightNeverChosen() {
        FuzzSettings settings = seeded(11L)
                .operationWeight(Operation.DELETE, 0.0)
                .operationWeight(Operation.MIXED, 0.0)
                .probabilityCuratedEdgeCase(0.5)
                .build();
        List<TestCase> cases = new FuzzGenerator(settings).generate(500);

        for (TestCase tc : cases) {
            assertNotEquals(Operation.DELETE, tc.getOperation());
            assertNotEquals(Operation.MIXED, tc.getOperation());
        }
    }

    @Test
    void next_batchSizesWithinBounds() {
        FuzzSettings settings = seeded(5L).maxVectorsPerBatch(6).maxQueriesPerBatch(4).maxSearchK(9).build();
        FuzzGenerator generator = new FuzzGenerator(settings);

        for (int i = 0; i < 200; i++) {
            InsertParams single = (InsertParams) generator.next(Operation.INSERT).getParams();
            InsertParams batch = (InsertParams) generator.next(Operation.BATCH_INSERT).getParams();
            SearchParams search = (SearchParams) generator.next(Operation.SEARCH).getParams();
            SearchParams batchSearch = (SearchParams) generator.next(Operation.BATCH_SEARCH).getParams();

            assertEquals(1, single.getVectors().size());
            assertEquals(single.getVectors().size(), single.getIds().size());
            assertEquals(single.getVectors().size(), single.getMetadata().size());
            assertTrue(batch.getVectors().size() >= 2 && batch.getVectors().size() <= 6);
            assertEquals(1, search.getQueries().size());
            assertTrue(search.getK() >= 1 && search.getK() <= 9);
            assertTrue(batchSearch.getQueries().size() >= 2 && batchSearch.getQueries().size() <= 4);
        }
    }

    @Test
    void next_mixedStepsShareStateAndRespectBounds() {
        FuzzGenerator generator = new FuzzGenerator(seeded(9L).mixedSteps(2, 5).build());

        for (int i = 0; i < 200; i++) {
            MixedParams mixed = (MixedParams) generator.next(Operation.MIXED).getParams();
            List<MixedStep> steps = mixed.getSteps();
            assertTrue(steps.size() >= 2 && steps.size() <= 5);
            assertEquals(Operation.INSERT, steps.get(0).getOperation());
            Set<String> inserted = new HashSet<>();
            for (MixedStep step : steps) {
                assertTrue(step.getOperation().isMixedStep());
                if (step.getParams() instanceof InsertParams p) inserted.addAll(p.getIds());
                if (step.getParams() instanceof DeleteParams p) {
                    assertTrue(inserted.containsAll(p.getIds()), "delete targets an id inserted earlier");
                }
            }
        }
    }

    @Test
    void nextEdgeCase_shapes() {
        FuzzGenerator generator = new FuzzGenerator(seeded(13L).probabilityCollectionOverride(0.0).build());

        InsertParams large = (InsertParams) generator.nextEdgeCase(EdgeCase.VERY_LARGE_VECTOR).getParams();
        assertEquals(10_000, large.getVectors().get(0).dimension());

        InsertParams batch = (InsertParams) generator.nextEdgeCase(EdgeCase.VERY_LARGE_BATCH).getParams();
        assertEquals(1_000, batch.getVectors().size());

        SearchParams nan = (SearchParams) generator.nextEdgeCase(EdgeCase.NAN_VALUES).getParams();
        assertTrue(Float.isNaN(nan.getQueries().get(0).get(0)));
        assertEquals(8, nan.getQueries().get(0).dimension());

        TestCase missing = generator.nextEdgeCase(EdgeCase.NONEXISTENT_COLLECTION);
        assertEquals("nonexistent_collection", missing.getCollection());

        DeleteParams malformed = (DeleteParams) generator.nextEdgeCase(EdgeCase.MALFORMED_ID).getParams();
        assertEquals(List.of("", "invalid@id", "id with spaces"), malformed.getIds());

        InsertParams empty = (InsertParams) generator.nextEdgeCase(EdgeCase.EMPTY_VECTOR).getParams();
        assertTrue(empty.getVectors().get(0).isEmpty());
    }

    @Test
    void constructor_invalidSettingsFailFast() {
        FuzzSettings invalid = FuzzSettings.builder().probabilityEmptyVector(0.8).probabilityOversizedVector(0.5).build();

        assertThrows(ConfigurationException.class, () -> new FuzzGenerator(invalid));
    }

    private static List<Vector> vectorsOf(TestCase tc) {
        if (tc.getParams() instanceof InsertParams p) return p.getVectors();
        if (tc.getParams() instanceof SearchParams p) return p.getQueries();
        return List.of();
    }
}
