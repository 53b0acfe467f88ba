package com.vdbfuzz.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vdbfuzz.model.Metric;
import com.vdbfuzz.model.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Knobs of the fuzz generator. Probabilities are in [0, 1]; dimension and size bounds are
 * inclusive. Defaults follow the long-standing values of the fuzzer (128-dimensional vectors,
 * batches up to 100, k up to 100).
 */
public final class FuzzSettings {

    public static final int DEFAULT_DIMENSION = 128;

    private final int vectorDimension;
    private final int minDimension;
    private final int maxDimension;
    private final double probabilityEmptyVector;
    private final double probabilityOversizedVector;
    private final int maxOversizedDimension;
    private final double probabilityWideRange;
    private final double probabilityEdgeComponent;
    private final int maxVectorsPerBatch;
    private final int maxQueriesPerBatch;
    private final int maxSearchK;
    private final double probabilityMalformedId;
    private final int oversizedIdLength;
    private final double probabilityMetadata;
    private final int maxMetadataFields;
    private final double probabilitySpecialChars;
    private final Metric collectionMetric;
    private final double probabilityAlternateMetric;
    private final double probabilityCollectionOverride;
    private final double probabilityCuratedEdgeCase;
    private final int minMixedSteps;
    private final int maxMixedSteps;
    private final Long seed;
    private final Map<String, Double> operationWeights;

    @JsonCreator
    public FuzzSettings(
            @JsonProperty("vectorDimension") Integer vectorDimension,
            @JsonProperty("minDimension") Integer minDimension,
            @JsonProperty("maxDimension") Integer maxDimension,
            @JsonProperty("probabilityEmptyVector") Double probabilityEmptyVector,
            @JsonProperty("probabilityOversizedVector") Double probabilityOversizedVector,
            @JsonProperty("maxOversizedDimension") Integer maxOversizedDimension,
            @JsonProperty("probabilityWideRange") Double probabilityWideRange,
            @JsonProperty("probabilityEdgeComponent") Double probabilityEdgeComponent,
            @JsonProperty("maxVectorsPerBatch") Integer maxVectorsPerBatch,
            @JsonProperty("maxQueriesPerBatch") Integer maxQueriesPerBatch,
            @JsonProperty("maxSearchK") Integer maxSearchK,
            @JsonProperty("probabilityMalformedId") Double probabilityMalformedId,
            @JsonProperty("oversizedIdLength") Integer oversizedIdLength,
            @JsonProperty("probabilityMetadata") Double probabilityMetadata,
            @JsonProperty("maxMetadataFields") Integer maxMetadataFields,
            @JsonProperty("probabilitySpecialChars") Double probabilitySpecialChars,
            @JsonProperty("collectionMetric") Metric collectionMetric,
            @JsonProperty("probabilityAlternateMetric") Double probabilityAlternateMetric,
            @JsonProperty("probabilityCollectionOverride") Double probabilityCollectionOverride,
            @JsonProperty("probabilityCuratedEdgeCase") Double probabilityCuratedEdgeCase,
            @JsonProperty("minMixedSteps") Integer minMixedSteps,
            @JsonProperty("maxMixedSteps") Integer maxMixedSteps,
            @JsonProperty("seed") Long seed,
            @JsonProperty("operationWeights") Map<String, Double> operationWeights) {
        this.vectorDimension = or(vectorDimension, DEFAULT_DIMENSION);
        this.minDimension = or(minDimension, this.vectorDimension);
        this.maxDimension = or(maxDimension, this.vectorDimension);
        this.probabilityEmptyVector = or(probabilityEmptyVector, 0.05);
        this.probabilityOversizedVector = or(probabilityOversizedVector, 0.05);
        this.maxOversizedDimension = or(maxOversizedDimension, 1000);
        this.probabilityWideRange = or(probabilityWideRange, 0.1);
        this.probabilityEdgeComponent = or(probabilityEdgeComponent, 0.001);
        this.maxVectorsPerBatch = or(maxVectorsPerBatch, 100);
        this.maxQueriesPerBatch = or(maxQueriesPerBatch, 10);
        this.maxSearchK = or(maxSearchK, 100);
        this.probabilityMalformedId = or(probabilityMalformedId, 0.05);
        this.oversizedIdLength = or(oversizedIdLength, 4096);
        this.probabilityMetadata = or(probabilityMetadata, 0.7);
        this.maxMetadataFields = or(maxMetadataFields, 10);
        this.probabilitySpecialChars = or(probabilitySpecialChars, 0.05);
        this.collectionMetric = collectionMetric != null ? collectionMetric : Metric.L2;
        this.probabilityAlternateMetric = or(probabilityAlternateMetric, 0.2);
        this.probabilityCollectionOverride = or(probabilityCollectionOverride, 0.05);
        this.probabilityCuratedEdgeCase = or(probabilityCuratedEdgeCase, 0.05);
        this.minMixedSteps = or(minMixedSteps, 2);
        this.maxMixedSteps = or(maxMixedSteps, 5);
        this.seed = seed;
        this.operationWeights = normalizeWeights(operationWeights);
    }

    /** All defaults, non-deterministic seed. */
    public static FuzzSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int or(Integer v, int d) {
        return v != null ? v : d;
    }

    private static double or(Double v, double d) {
        return v != null ? v : d;
    }

    /** Keys normalised to operation wire names; operations missing from the map get weight 1.0. */
    private static Map<String, Double> normalizeWeights(Map<String, Double> weights) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Operation op : Operation.values()) {
            out.put(op.getWireName(), 1.0);
        }
        if (weights != null) {
            for (Map.Entry<String, Double> e : weights.entrySet()) {
                Operation op;
                try {
                    op = Operation.fromWireName(e.getKey());
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("operationWeights: " + ex.getMessage(), ex);
                }
                out.put(op.getWireName(), e.getValue() != null ? e.getValue() : 0.0);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Checks ranges and bounds.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        positive(problems, "vectorDimension", vectorDimension);
        positive(problems, "minDimension", minDimension);
        if (maxDimension < minDimension) problems.add("maxDimension must be >= minDimension");
        if (maxOversizedDimension < maxDimension) problems.add("maxOversizedDimension must be >= maxDimension");
        positive(problems, "maxVectorsPerBatch", maxVectorsPerBatch);
        positive(problems, "maxQueriesPerBatch", maxQueriesPerBatch);
        positive(problems, "maxSearchK", maxSearchK);
        positive(problems, "oversizedIdLength", oversizedIdLength);
        if (maxMetadataFields < 0) problems.add("maxMetadataFields must be >= 0");
        if (minMixedSteps < 2) problems.add("minMixedSteps must be >= 2");
        if (maxMixedSteps < minMixedSteps) problems.add("maxMixedSteps must be >= minMixedSteps");
        probability(problems, "probabilityEmptyVector", probabilityEmptyVector);
        probability(problems, "probabilityOversizedVector", probabilityOversizedVector);
        probability(problems, "probabilityWideRange", probabilityWideRange);
        probability(problems, "probabilityEdgeComponent", probabilityEdgeComponent);
        probability(problems, "probabilityMalformedId", probabilityMalformedId);
        probability(problems, "probabilityMetadata", probabilityMetadata);
        probability(problems, "probabilitySpecialChars", probabilitySpecialChars);
        probability(problems, "probabilityAlternateMetric", probabilityAlternateMetric);
        probability(problems, "probabilityCollectionOverride", probabilityCollectionOverride);
        probability(problems, "probabilityCuratedEdgeCase", probabilityCuratedEdgeCase);
        if (probabilityEmptyVector + probabilityOversizedVector > 1.0) {
            problems.add("probabilityEmptyVector + probabilityOversizedVector must be <= 1");
        }
        double total = 0;
        for (Map.Entry<String, Double> e : operationWeights.entrySet()) {
            if (!(e.getValue() >= 0) || e.getValue().isInfinite()) {
                problems.add("operationWeights." + e.getKey() + " must be a finite non-negative number");
            } else {
                total += e.getValue();
            }
        }
        if (total <= 0) problems.add("operationWeights must have at least one positive weight");
        if (!problems.isEmpty()) throw new ConfigurationException(problems);
    }

    private static void positive(List<String> problems, String name, int value) {
        if (value < 1) problems.add(name + " must be >= 1");
    }

    private static void probability(List<String> problems, String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) problems.add(name + " must be within [0, 1]");
    }

    /** Dimension of the collections created for the run. */
    public int getVectorDimension() {
        return vectorDimension;
    }

    /** Lower bound of the regular generated vector dimension. */
    public int getMinDimension() {
        return minDimension;
    }

    /** Upper bound of the regular generated vector dimension. */
    public int getMaxDimension() {
        return maxDimension;
    }

    public double getProbabilityEmptyVector() {
        return probabilityEmptyVector;
    }

    public double getProbabilityOversizedVector() {
        return probabilityOversizedVector;
    }

    public int getMaxOversizedDimension() {
        return maxOversizedDimension;
    }

    /** Per component: draw from [-10, 10] instead of [-1, 1]. */
    public double getProbabilityWideRange() {
        return probabilityWideRange;
    }

    /** Per component: replace the value with one of 0.0, NaN, +Inf, -Inf. */
    public double getProbabilityEdgeComponent() {
        return probabilityEdgeComponent;
    }

    public int getMaxVectorsPerBatch() {
        return maxVectorsPerBatch;
    }

    public int getMaxQueriesPerBatch() {
        return maxQueriesPerBatch;
    }

    public int getMaxSearchK() {
        return maxSearchK;
    }

    public double getProbabilityMalformedId() {
        return probabilityMalformedId;
    }

    public int getOversizedIdLength() {
        return oversizedIdLength;
    }

    /** Per vector: attach a metadata map. */
    public double getProbabilityMetadata() {
        return probabilityMetadata;
    }

    public int getMaxMetadataFields() {
        return maxMetadataFields;
    }

    public double getProbabilitySpecialChars() {
        return probabilitySpecialChars;
    }

    /** Metric the run's collections are created with; searches use it unless an alternate is drawn. */
    public Metric getCollectionMetric() {
        return collectionMetric;
    }

    public double getProbabilityAlternateMetric() {
        return probabilityAlternateMetric;
    }

    public double getProbabilityCollectionOverride() {
        return probabilityCollectionOverride;
    }

    public double getProbabilityCuratedEdgeCase() {
        return probabilityCuratedEdgeCase;
    }

    public int getMinMixedSteps() {
        return minMixedSteps;
    }

    public int getMaxMixedSteps() {
        return maxMixedSteps;
    }

    /** Random seed; null = non-deterministic. */
    public Long getSeed() {
        return seed;
    }

    /** Operation wire name → weight, every operation present. */
    public Map<String, Double> getOperationWeights() {
        return operationWeights;
    }

    public Map<Operation, Double> operationWeightsByOperation() {
        Map<Operation, Double> out = new EnumMap<>(Operation.class);
        for (Map.Entry<String, Double> e : operationWeights.entrySet()) {
            out.put(Operation.fromWireName(e.getKey()), e.getValue());
        }
        return out;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.vectorDimension = vectorDimension;
        b.minDimension = minDimension;
        b.maxDimension = maxDimension;
        b.probabilityEmptyVector = probabilityEmptyVector;
        b.probabilityOversizedVector = probabilityOversizedVector;
        b.maxOversizedDimension = maxOversizedDimension;
        b.probabilityWideRange = probabilityWideRange;
        b.probabilityEdgeComponent = probabilityEdgeComponent;
        b.maxVectorsPerBatch = maxVectorsPerBatch;
        b.maxQueriesPerBatch = maxQueriesPerBatch;
        b.maxSearchK = maxSearchK;
        b.probabilityMalformedId = probabilityMalformedId;
        b.oversizedIdLength = oversizedIdLength;
        b.probabilityMetadata = probabilityMetadata;
        b.maxMetadataFields = maxMetadataFields;
        b.probabilitySpecialChars = probabilitySpecialChars;
        b.collectionMetric = collectionMetric;
        b.probabilityAlternateMetric = probabilityAlternateMetric;
        b.probabilityCollectionOverride = probabilityCollectionOverride;
        b.probabilityCuratedEdgeCase = probabilityCuratedEdgeCase;
        b.minMixedSteps = minMixedSteps;
        b.maxMixedSteps = maxMixedSteps;
        b.seed = seed;
        b.operationWeights = new LinkedHashMap<>(operationWeights);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuzzSettings that = (FuzzSettings) o;
        return vectorDimension == that.vectorDimension && minDimension == that.minDimension
                && maxDimension == that.maxDimension
                && Double.compare(probabilityEmptyVector, that.probabilityEmptyVector) == 0
                && Double.compare(probabilityOversizedVector, that.probabilityOversizedVector) == 0
                && maxOversizedDimension == that.maxOversizedDimension
                && Double.compare(probabilityWideRange, that.probabilityWideRange) == 0
                && Double.compare(probabilityEdgeComponent, that.probabilityEdgeComponent) == 0
                && maxVectorsPerBatch == that.maxVectorsPerBatch && maxQueriesPerBatch == that.maxQueriesPerBatch
                && maxSearchK == that.maxSearchK
                && Double.compare(probabilityMalformedId, that.probabilityMalformedId) == 0
                && oversizedIdLength == that.oversizedIdLength
                && Double.compare(probabilityMetadata, that.probabilityMetadata) == 0
                && maxMetadataFields == that.maxMetadataFields
                && Double.compare(probabilitySpecialChars, that.probabilitySpecialChars) == 0
                && collectionMetric == that.collectionMetric
                && Double.compare(probabilityAlternateMetric, that.probabilityAlternateMetric) == 0
                && Double.compare(probabilityCollectionOverride, that.probabilityCollectionOverride) == 0
                && Double.compare(probabilityCuratedEdgeCase, that.probabilityCuratedEdgeCase) == 0
                && minMixedSteps == that.minMixedSteps && maxMixedSteps == that.maxMixedSteps
                && Objects.equals(seed, that.seed) && operationWeights.equals(that.operationWeights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectorDimension, minDimension, maxDimension, maxVectorsPerBatch, maxSearchK,
                collectionMetric, seed, operationWeights);
    }

    public static final class Builder {
        private Integer vectorDimension;
        private Integer minDimension;
        private Integer maxDimension;
        private Double probabilityEmptyVector;
        private Double probabilityOversizedVector;
        private Integer maxOversizedDimension;
        private Double probabilityWideRange;
        private Double probabilityEdgeComponent;
        private Integer maxVectorsPerBatch;
        private Integer maxQueriesPerBatch;
        private Integer maxSearchK;
        private Double probabilityMalformedId;
        private Integer oversizedIdLength;
        private Double probabilityMetadata;
        private Integer maxMetadataFields;
        private Double probabilitySpecialChars;
        private Metric collectionMetric;
        private Double probabilityAlternateMetric;
        private Double probabilityCollectionOverride;
        private Double probabilityCuratedEdgeCase;
        private Integer minMixedSteps;
        private Integer maxMixedSteps;
        private Long seed;
        private Map<String, Double> operationWeights;

        public Builder vectorDimension(int v) {
            this.vectorDimension = v;
            return this;
        }

        public Builder dimensionRange(int min, int max) {
            this.minDimension = min;
            this.maxDimension = max;
            return this;
        }

        public Builder probabilityEmptyVector(double p) {
            this.probabilityEmptyVector = p;
            return this;
        }

        public Builder probabilityOversizedVector(double p) {
            this.probabilityOversizedVector = p;
            return this;
        }

        public Builder maxOversizedDimension(int v) {
            this.maxOversizedDimension = v;
            return this;
        }

        public Builder probabilityWideRange(double p) {
            this.probabilityWideRange = p;
            return this;
        }

        public Builder probabilityEdgeComponent(double p) {
            this.probabilityEdgeComponent = p;
            return this;
        }

        public Builder maxVectorsPerBatch(int v) {
            this.maxVectorsPerBatch = v;
            return this;
        }

        public Builder maxQueriesPerBatch(int v) {
            this.maxQueriesPerBatch = v;
            return this;
        }

        public Builder maxSearchK(int v) {
            this.maxSearchK = v;
            return this;
        }

        public Builder probabilityMalformedId(double p) {
            this.probabilityMalformedId = p;
            return this;
        }

        public Builder oversizedIdLength(int v) {
            this.oversizedIdLength = v;
            return this;
        }

        public Builder probabilityMetadata(double p) {
            this.probabilityMetadata = p;
            return this;
        }

        public Builder maxMetadataFields(int v) {
            this.maxMetadataFields = v;
            return this;
        }

        public Builder probabilitySpecialChars(double p) {
            this.probabilitySpecialChars = p;
            return this;
        }

        public Builder collectionMetric(Metric metric) {
            this.collectionMetric = metric;
            return this;
        }

        public Builder probabilityAlternateMetric(double p) {
            this.probabilityAlternateMetric = p;
            return this;
        }

        public Builder probabilityCollectionOverride(double p) {
            this.probabilityCollectionOverride = p;
            return this;
        }

        public Builder probabilityCuratedEdgeCase(double p) {
            this.probabilityCuratedEdgeCase = p;
            return this;
        }

        public Builder mixedSteps(int min, int max) {
            this.minMixedSteps = min;
            this.maxMixedSteps = max;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder operationWeight(Operation operation, double weight) {
            if (operationWeights == null) operationWeights = new LinkedHashMap<>();
            operationWeights.put(operation.getWireName(), weight);
            return this;
        }

        public Builder operationWeights(Map<String, Double> weights) {
            this.operationWeights = weights != null ? new LinkedHashMap<>(weights) : null;
            return this;
        }

        public FuzzSettings build() {
            return new FuzzSettings(vectorDimension, minDimension, maxDimension, probabilityEmptyVector,
                    probabilityOversizedVector, maxOversizedDimension, probabilityWideRange, probabilityEdgeComponent,
                    maxVectorsPerBatch, maxQueriesPerBatch, maxSearchK, probabilityMalformedId, oversizedIdLength,
                    probabilityMetadata, maxMetadataFields, probabilitySpecialChars, collectionMetric,
                    probabilityAlternateMetric, probabilityCollectionOverride, probabilityCuratedEdgeCase,
                    minMixedSteps, maxMixedSteps, seed, operationWeights);
        }
    }
}
