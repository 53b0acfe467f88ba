package com.vdbfuzz.generator;

import com.vdbfuzz.config.FuzzSettings;
import com.vdbfuzz.model.DeleteParams;
import com.vdbfuzz.model.InsertParams;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.MixedParams;
import com.vdbfuzz.model.MixedStep;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.OperationParams;
import com.vdbfuzz.model.SearchParams;
import com.vdbfuzz.model.TestCase;
import com.vdbfuzz.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Produces fuzz test cases. With a seed the sequence is fully reproducible; without one each run
 * differs. Not thread-safe: one generator feeds one run.
 * <p>
 * Each case targets the services' configured collection unless, with low probability, it carries
 * a collection override taken from a list of awkward names. Curated edge cases are mixed in with
 * their own probability, restricted to operations whose weight is positive.
 */
public final class FuzzGenerator {

    private static final Logger log = LoggerFactory.getLogger(FuzzGenerator.class);

    static final List<String> COLLECTION_OVERRIDES = List.of(
            "", "invalid-name", "123", "name with spaces", "!@#$%", "nonexistent_collection");
    static final List<String> INVALID_DELETE_IDS = List.of("invalid_id_1", "nonexistent_id", "");
    static final List<String> MALFORMED_IDS = List.of("", "invalid@id", "id with spaces");
    static final String NONEXISTENT_COLLECTION = "nonexistent_collection";

    private static final int MAX_DELETE_IDS = 50;
    private static final int MAX_MIXED_SEARCH_K = 20;

    private final FuzzSettings settings;
    private final Random random;
    private final WeightedChoice<Operation> operations;
    private final List<EdgeCase> edgeCases;
    private final VectorFactory vectors;
    private final IdFactory ids;
    private final MetadataFactory metadata;
    private long nextTestId = 1;

    public FuzzGenerator(FuzzSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        settings.validate();
        this.random = settings.getSeed() != null ? new Random(settings.getSeed()) : new Random();
        this.operations = new WeightedChoice<>(settings.operationWeightsByOperation());
        List<EdgeCase> allowed = new ArrayList<>();
        for (EdgeCase e : EdgeCase.values()) {
            if (operations.canPick(e.getOperation())) allowed.add(e);
        }
        this.edgeCases = Collections.unmodifiableList(allowed);
        this.vectors = new VectorFactory(settings, random);
        this.ids = new IdFactory(settings, random);
        this.metadata = new MetadataFactory(settings, random);
        log.info("Fuzz generator ready | seed={} | dimension={} | weights={}",
                settings.getSeed() != null ? settings.getSeed() : "random",
                settings.getVectorDimension(), settings.getOperationWeights());
    }

    public FuzzSettings getSettings() {
        return settings;
    }

    /** Next test case: a curated edge case with the configured probability, else a random one. */
    public TestCase next() {
        if (!edgeCases.isEmpty() && random.nextDouble() < settings.getProbabilityCuratedEdgeCase()) {
            return nextEdgeCase(edgeCases.get(random.nextInt(edgeCases.size())));
        }
        return next(operations.pick(random));
    }

    /** Next random test case for the given operation. */
    public TestCase next(Operation operation) {
        String collection = collection();
        return switch (operation) {
            case INSERT -> testCase(operation, collection, insertParams(1));
            case BATCH_INSERT -> testCase(operation, collection, insertParams(between(2, Math.max(2, settings.getMaxVectorsPerBatch()))));
            case SEARCH -> testCase(operation, collection, searchParams(1, settings.getMaxSearchK()));
            case BATCH_SEARCH -> testCase(operation, collection,
                    searchParams(between(2, Math.max(2, settings.getMaxQueriesPerBatch())), settings.getMaxSearchK()));
            case DELETE -> testCase(operation, collection, deleteParams());
            case MIXED -> testCase(operation, collection, mixedParams());
        };
    }

    /** Next curated edge case chosen at random among all of them. */
    public TestCase nextEdgeCase() {
        return nextEdgeCase(EdgeCase.values()[random.nextInt(EdgeCase.values().length)]);
    }

    public TestCase nextEdgeCase(EdgeCase edgeCase) {
        int dim = settings.getVectorDimension();
        return switch (edgeCase) {
            case EMPTY_VECTOR -> testCase(Operation.INSERT, collection(),
                    new InsertParams(List.of(Vector.of()), List.of("empty_id"), List.of(Map.of())));
            case VERY_LARGE_VECTOR -> testCase(Operation.INSERT, collection(),
                    new InsertParams(List.of(vectors.random(EdgeCase.VERY_LARGE_DIMENSION, 0, 0)),
                            List.of("large_vector_id"), List.of(Map.of())));
            case NAN_VALUES -> testCase(Operation.SEARCH, collection(),
                    new SearchParams(List.of(vectors.withEvery10th(Float.NaN)), 10, Metric.L2));
            case INF_VALUES -> testCase(Operation.SEARCH, collection(),
                    new SearchParams(List.of(vectors.withEvery10th(Float.POSITIVE_INFINITY)), 10, Metric.L2));
            case VERY_LARGE_BATCH -> {
                int n = EdgeCase.VERY_LARGE_BATCH_SIZE;
                List<Vector> vs = new ArrayList<>(n);
                List<String> is = new ArrayList<>(n);
                List<Map<String, Object>> ms = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    vs.add(vectors.random(dim, 0, 0));
                    is.add(ids.fresh());
                    ms.add(Map.of());
                }
                yield testCase(Operation.BATCH_INSERT, collection(), new InsertParams(vs, is, ms));
            }
            case EMPTY_METADATA -> testCase(Operation.INSERT, collection(),
                    new InsertParams(List.of(vectors.next()), List.of("empty_metadata_id"), List.of(Map.of())));
            case MALFORMED_ID -> testCase(Operation.DELETE, collection(), new DeleteParams(MALFORMED_IDS));
            case NONEXISTENT_COLLECTION -> testCase(Operation.SEARCH, NONEXISTENT_COLLECTION,
                    new SearchParams(List.of(vectors.next()), 10, Metric.L2));
        };
    }

    /** The next {@code count} test cases. */
    public List<TestCase> generate(int count) {
        List<TestCase> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(next());
        return out;
    }

    private TestCase testCase(Operation operation, String collection, OperationParams params) {
        return new TestCase(nextTestId++, operation, collection, params);
    }

    /** Null (each service's own collection) unless the override branch fires. */
    private String collection() {
        if (random.nextDouble() < settings.getProbabilityCollectionOverride()) {
            return COLLECTION_OVERRIDES.get(random.nextInt(COLLECTION_OVERRIDES.size()));
        }
        return null;
    }

    private InsertParams insertParams(int count) {
        List<Vector> vs = new ArrayList<>(count);
        List<String> is = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vs.add(vectors.next());
            is.add(ids.next());
        }
        return new InsertParams(vs, is, metadata.forVectors(count));
    }

    private SearchParams searchParams(int queries, int maxK) {
        List<Vector> qs = new ArrayList<>(queries);
        for (int i = 0; i < queries; i++) qs.add(vectors.next());
        return new SearchParams(qs, between(1, maxK), metric());
    }

    /** The collection metric, or with the configured probability one of the others. */
    private Metric metric() {
        Metric collectionMetric = settings.getCollectionMetric();
        if (random.nextDouble() >= settings.getProbabilityAlternateMetric()) return collectionMetric;
        List<Metric> others = new ArrayList<>();
        for (Metric m : Metric.values()) {
            if (m != collectionMetric) others.add(m);
        }
        return others.get(random.nextInt(others.size()));
    }

    private DeleteParams deleteParams() {
        int n = between(1, MAX_DELETE_IDS);
        List<String> targets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            targets.add(ids.hasIssued() && random.nextBoolean() ? ids.previouslyIssued() : ids.unused());
        }
        if (random.nextDouble() < 0.2) targets.addAll(INVALID_DELETE_IDS);
        return new DeleteParams(targets);
    }

    private MixedParams mixedParams() {
        int steps = between(settings.getMinMixedSteps(), settings.getMaxMixedSteps());
        List<String> insertedHere = new ArrayList<>();
        List<MixedStep> out = new ArrayList<>(steps);
        for (int i = 0; i < steps; i++) {
            // the first step always inserts so later steps have state to act on
            int kind = i == 0 ? 0 : random.nextInt(3);
            if (kind == 0) {
                String id = ids.fresh();
                insertedHere.add(id);
                out.add(new MixedStep(Operation.INSERT, new InsertParams(
                        List.of(vectors.next()), List.of(id), metadata.forVectors(1))));
            } else if (kind == 1) {
                out.add(new MixedStep(Operation.SEARCH, new SearchParams(
                        List.of(vectors.next()), between(1, Math.min(MAX_MIXED_SEARCH_K, settings.getMaxSearchK())),
                        settings.getCollectionMetric())));
            } else {
                String target = !insertedHere.isEmpty()
                        ? insertedHere.get(random.nextInt(insertedHere.size()))
                        : ids.unused();
                out.add(new MixedStep(Operation.DELETE, new DeleteParams(List.of(target))));
            }
        }
        return new MixedParams(out);
    }

    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
