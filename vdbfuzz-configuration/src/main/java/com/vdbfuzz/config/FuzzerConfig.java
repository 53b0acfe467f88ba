package com.vdbfuzz.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vdbfuzz.model.Metric;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable configuration of a fuzz run, threaded explicitly to every component.
 * <p>
 * Sources: {@link #fromEnvironment()} (VDBFUZZ_* variables), {@link #fromJson(String)} /
 * {@link #load(Path)}, or {@link #builder()}. Environment variables:
 * <ul>
 *   <li>VDBFUZZ_CONFIG_FILE – JSON file; when set, the remaining variables are ignored</li>
 *   <li>VDBFUZZ_SERVICES – comma-separated service names (default milvus,chroma,qdrant,weaviate)</li>
 *   <li>VDBFUZZ_&lt;SERVICE&gt;_HOST / _PORT / _COLLECTION / _DATABASE / _USERNAME / _PASSWORD</li>
 *   <li>VDBFUZZ_TEST_COUNT, VDBFUZZ_BATCH_SIZE, VDBFUZZ_THREADS</li>
 *   <li>VDBFUZZ_CALL_TIMEOUT_MS, VDBFUZZ_PROBE_TIMEOUT_MS, VDBFUZZ_HEALTH_MODE, VDBFUZZ_REPROBE_INTERVAL_MS</li>
 *   <li>VDBFUZZ_SEED, VDBFUZZ_DIMENSION, VDBFUZZ_METRIC</li>
 *   <li>VDBFUZZ_OVERLAP_THRESHOLD, VDBFUZZ_UNHEALTHY_POLICY</li>
 *   <li>VDBFUZZ_RESULTS_FILE, VDBFUZZ_DROP_COLLECTIONS, VDBFUZZ_METRICS_ENABLED</li>
 * </ul>
 */
public final class FuzzerConfig {

    private static final String ENV_PREFIX = "VDBFUZZ_";
    private static final String ENV_CONFIG_FILE = "VDBFUZZ_CONFIG_FILE";
    private static final String ENV_SERVICES = "VDBFUZZ_SERVICES";
    private static final String ENV_TEST_COUNT = "VDBFUZZ_TEST_COUNT";
    private static final String ENV_BATCH_SIZE = "VDBFUZZ_BATCH_SIZE";
    private static final String ENV_THREADS = "VDBFUZZ_THREADS";
    private static final String ENV_CALL_TIMEOUT_MS = "VDBFUZZ_CALL_TIMEOUT_MS";
    private static final String ENV_PROBE_TIMEOUT_MS = "VDBFUZZ_PROBE_TIMEOUT_MS";
    private static final String ENV_HEALTH_MODE = "VDBFUZZ_HEALTH_MODE";
    private static final String ENV_REPROBE_INTERVAL_MS = "VDBFUZZ_REPROBE_INTERVAL_MS";
    private static final String ENV_SEED = "VDBFUZZ_SEED";
    private static final String ENV_DIMENSION = "VDBFUZZ_DIMENSION";
    private static final String ENV_METRIC = "VDBFUZZ_METRIC";
    private static final String ENV_OVERLAP_THRESHOLD = "VDBFUZZ_OVERLAP_THRESHOLD";
    private static final String ENV_UNHEALTHY_POLICY = "VDBFUZZ_UNHEALTHY_POLICY";
    private static final String ENV_RESULTS_FILE = "VDBFUZZ_RESULTS_FILE";
    private static final String ENV_DROP_COLLECTIONS = "VDBFUZZ_DROP_COLLECTIONS";
    private static final String ENV_METRICS_ENABLED = "VDBFUZZ_METRICS_ENABLED";

    public static final List<String> DEFAULT_SERVICES = List.of("milvus", "chroma", "qdrant", "weaviate");
    private static final long DEFAULT_CALL_TIMEOUT_MILLIS = 30_000L;
    private static final long DEFAULT_PROBE_TIMEOUT_MILLIS = 2_000L;
    private static final int DEFAULT_TEST_COUNT = 100;
    private static final int DEFAULT_BATCH_SIZE = 10;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final List<ServiceConfig> services;
    private final FuzzSettings fuzzSettings;
    private final ComparisonPolicy comparisonPolicy;
    private final HealthMode healthMode;
    private final long healthReprobeIntervalMillis;
    private final long callTimeoutMillis;
    private final long healthProbeTimeoutMillis;
    private final int testCount;
    private final int batchSize;
    private final int dispatcherThreads;
    private final String resultsFile;
    private final boolean dropCollectionsOnFinish;
    private final boolean metricsEnabled;

    @JsonCreator
    public FuzzerConfig(
            @JsonProperty("services") List<ServiceConfig> services,
            @JsonProperty("fuzzSettings") FuzzSettings fuzzSettings,
            @JsonProperty("comparisonPolicy") ComparisonPolicy comparisonPolicy,
            @JsonProperty("healthMode") HealthMode healthMode,
            @JsonProperty("healthReprobeIntervalMillis") Long healthReprobeIntervalMillis,
            @JsonProperty("callTimeoutMillis") Long callTimeoutMillis,
            @JsonProperty("healthProbeTimeoutMillis") Long healthProbeTimeoutMillis,
            @JsonProperty("testCount") Integer testCount,
            @JsonProperty("batchSize") Integer batchSize,
            @JsonProperty("dispatcherThreads") Integer dispatcherThreads,
            @JsonProperty("resultsFile") String resultsFile,
            @JsonProperty("dropCollectionsOnFinish") Boolean dropCollectionsOnFinish,
            @JsonProperty("metricsEnabled") Boolean metricsEnabled) {
        this.services = services != null
                ? List.copyOf(services)
                : DEFAULT_SERVICES.stream().map(ServiceConfig::defaults).collect(Collectors.toUnmodifiableList());
        this.fuzzSettings = fuzzSettings != null ? fuzzSettings : FuzzSettings.defaults();
        this.comparisonPolicy = comparisonPolicy != null ? comparisonPolicy : ComparisonPolicy.defaults();
        this.healthMode = healthMode != null ? healthMode : HealthMode.DEFAULT;
        this.healthReprobeIntervalMillis = healthReprobeIntervalMillis != null ? healthReprobeIntervalMillis : 0L;
        this.callTimeoutMillis = callTimeoutMillis != null ? callTimeoutMillis : DEFAULT_CALL_TIMEOUT_MILLIS;
        this.healthProbeTimeoutMillis = healthProbeTimeoutMillis != null ? healthProbeTimeoutMillis : DEFAULT_PROBE_TIMEOUT_MILLIS;
        this.testCount = testCount != null ? testCount : DEFAULT_TEST_COUNT;
        this.batchSize = batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
        this.dispatcherThreads = dispatcherThreads != null ? dispatcherThreads : 0;
        this.resultsFile = resultsFile != null && !resultsFile.isBlank() ? resultsFile.trim() : null;
        this.dropCollectionsOnFinish = dropCollectionsOnFinish != null && dropCollectionsOnFinish;
        this.metricsEnabled = metricsEnabled == null || metricsEnabled;
    }

    /** All defaults: the four built-in services on localhost. */
    public static FuzzerConfig defaults() {
        return builder().build();
    }

    public static FuzzerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds configuration from the given variables (normally {@link System#getenv()}).
     *
     * @throws ConfigurationException when a value cannot be parsed or the result is invalid
     */
    public static FuzzerConfig fromEnvironment(Map<String, String> env) {
        String file = get(env, ENV_CONFIG_FILE, null);
        if (file != null) {
            return load(Path.of(file));
        }
        List<String> names = parseCommaSeparated(get(env, ENV_SERVICES, null));
        if (names.isEmpty()) names = DEFAULT_SERVICES;
        List<ServiceConfig> services = new ArrayList<>();
        for (String name : names) {
            String key = ENV_PREFIX + name.toUpperCase(Locale.ROOT) + "_";
            services.add(new ServiceConfig(name, null,
                    get(env, key + "HOST", null),
                    parseInteger(env, key + "PORT"),
                    get(env, key + "COLLECTION", null),
                    get(env, key + "DATABASE", null),
                    get(env, key + "USERNAME", null),
                    get(env, key + "PASSWORD", null),
                    null));
        }
        FuzzSettings.Builder fuzz = FuzzSettings.builder();
        Integer dimension = parseInteger(env, ENV_DIMENSION);
        if (dimension != null) fuzz.vectorDimension(dimension);
        String seed = get(env, ENV_SEED, null);
        if (seed != null) fuzz.seed(parseLong(ENV_SEED, seed));
        String metric = get(env, ENV_METRIC, null);
        if (metric != null) fuzz.collectionMetric(parseEnum(ENV_METRIC, metric, Metric::fromWireName));

        ComparisonPolicy policy = ComparisonPolicy.defaults();
        String threshold = get(env, ENV_OVERLAP_THRESHOLD, null);
        if (threshold != null) policy = policy.withSearchOverlapThreshold(parseDouble(ENV_OVERLAP_THRESHOLD, threshold));
        String unhealthy = get(env, ENV_UNHEALTHY_POLICY, null);
        if (unhealthy != null) {
            policy = policy.withUnhealthyServicePolicy(parseEnum(ENV_UNHEALTHY_POLICY, unhealthy,
                    v -> UnhealthyServicePolicy.valueOf(v.toUpperCase(Locale.ROOT))));
        }

        Builder b = builder()
                .services(services)
                .fuzzSettings(fuzz.build())
                .comparisonPolicy(policy)
                .resultsFile(get(env, ENV_RESULTS_FILE, null))
                .dropCollectionsOnFinish(parseBoolean(get(env, ENV_DROP_COLLECTIONS, null), false))
                .metricsEnabled(parseBoolean(get(env, ENV_METRICS_ENABLED, null), true));
        String mode = get(env, ENV_HEALTH_MODE, null);
        if (mode != null) b.healthMode(parseEnum(ENV_HEALTH_MODE, mode, v -> HealthMode.valueOf(v.toUpperCase(Locale.ROOT))));
        Integer testCount = parseInteger(env, ENV_TEST_COUNT);
        if (testCount != null) b.testCount(testCount);
        Integer batchSize = parseInteger(env, ENV_BATCH_SIZE);
        if (batchSize != null) b.batchSize(batchSize);
        Integer threads = parseInteger(env, ENV_THREADS);
        if (threads != null) b.dispatcherThreads(threads);
        Integer callTimeout = parseInteger(env, ENV_CALL_TIMEOUT_MS);
        if (callTimeout != null) b.callTimeoutMillis(callTimeout);
        Integer probeTimeout = parseInteger(env, ENV_PROBE_TIMEOUT_MS);
        if (probeTimeout != null) b.healthProbeTimeoutMillis(probeTimeout);
        Integer reprobe = parseInteger(env, ENV_REPROBE_INTERVAL_MS);
        if (reprobe != null) b.healthReprobeIntervalMillis(reprobe);
        return b.build();
    }

    /**
     * Parses configuration JSON. Unknown properties are rejected so typos surface early.
     *
     * @throws ConfigurationException on malformed JSON or invalid values
     */
    public static FuzzerConfig fromJson(String json) {
        try {
            FuzzerConfig config = MAPPER.readValue(json, FuzzerConfig.class);
            config.validate();
            return config;
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigurationException ce) throw ce;
            throw new ConfigurationException("Invalid configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Reads and parses a JSON configuration file. */
    public static FuzzerConfig load(Path path) {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration", e);
        }
    }

    /**
     * Validates the whole configuration.
     *
     * @throws ConfigurationException listing every problem
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ServiceConfig s : services) {
            if (!seen.add(s.getName())) problems.add("duplicate service: " + s.getName());
            if (s.getPort() < 1 || s.getPort() > 65535) problems.add("service " + s.getName() + ": port out of range");
            if (s.getCollection() == null) problems.add("service " + s.getName() + ": collection must be set");
        }
        if (services.stream().noneMatch(ServiceConfig::isEnabled)) problems.add("at least one service must be enabled");
        if (callTimeoutMillis < 1) problems.add("callTimeoutMillis must be >= 1");
        if (healthProbeTimeoutMillis < 1) problems.add("healthProbeTimeoutMillis must be >= 1");
        if (healthReprobeIntervalMillis < 0) problems.add("healthReprobeIntervalMillis must be >= 0");
        if (testCount < 0) problems.add("testCount must be >= 0");
        if (batchSize < 1) problems.add("batchSize must be >= 1");
        if (dispatcherThreads < 0) problems.add("dispatcherThreads must be >= 0");
        double threshold = comparisonPolicy.getSearchOverlapThreshold();
        if (!(threshold >= 0.0 && threshold <= 1.0)) problems.add("searchOverlapThreshold must be within [0, 1]");
        try {
            fuzzSettings.validate();
        } catch (ConfigurationException e) {
            problems.addAll(e.getProblems());
        }
        if (!problems.isEmpty()) throw new ConfigurationException(problems);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .services(services)
                .fuzzSettings(fuzzSettings)
                .comparisonPolicy(comparisonPolicy)
                .healthMode(healthMode)
                .healthReprobeIntervalMillis(healthReprobeIntervalMillis)
                .callTimeoutMillis(callTimeoutMillis)
                .healthProbeTimeoutMillis(healthProbeTimeoutMillis)
                .testCount(testCount)
                .batchSize(batchSize)
                .dispatcherThreads(dispatcherThreads)
                .resultsFile(resultsFile)
                .dropCollectionsOnFinish(dropCollectionsOnFinish)
                .metricsEnabled(metricsEnabled);
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static Integer parseInteger(Map<String, String> env, String key) {
        String value = get(env, key, null);
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static <T> T parseEnum(String key, String value, java.util.function.Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key + " has an unknown value: " + value, e);
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env != null ? env.get(key) : null;
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    /** Services in configuration order, enabled or not. */
    public List<ServiceConfig> getServices() {
        return services;
    }

    /** Enabled services in configuration order. */
    public List<ServiceConfig> enabledServices() {
        return services.stream().filter(ServiceConfig::isEnabled).collect(Collectors.toUnmodifiableList());
    }

    public FuzzSettings getFuzzSettings() {
        return fuzzSettings;
    }

    public ComparisonPolicy getComparisonPolicy() {
        return comparisonPolicy;
    }

    public HealthMode getHealthMode() {
        return healthMode;
    }

    /** Re-probe all services at the first batch boundary after this interval; 0 disables. */
    public long getHealthReprobeIntervalMillis() {
        return healthReprobeIntervalMillis;
    }

    /** Per-service deadline of one operation. Default 30 s. */
    public long getCallTimeoutMillis() {
        return callTimeoutMillis;
    }

    /** Deadline of one health probe request. Default 2 s. */
    public long getHealthProbeTimeoutMillis() {
        return healthProbeTimeoutMillis;
    }

    public int getTestCount() {
        return testCount;
    }

    /** Test cases per batch; the health snapshot is fixed for a batch. */
    public int getBatchSize() {
        return batchSize;
    }

    /** Dispatcher pool size; 0 = one thread per enabled service. */
    public int getDispatcherThreads() {
        return dispatcherThreads;
    }

    /** JSON-lines file receiving one record per test case; null = not written. */
    public String getResultsFile() {
        return resultsFile;
    }

    public boolean isDropCollectionsOnFinish() {
        return dropCollectionsOnFinish;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuzzerConfig that = (FuzzerConfig) o;
        return healthReprobeIntervalMillis == that.healthReprobeIntervalMillis
                && callTimeoutMillis == that.callTimeoutMillis
                && healthProbeTimeoutMillis == that.healthProbeTimeoutMillis
                && testCount == that.testCount && batchSize == that.batchSize
                && dispatcherThreads == that.dispatcherThreads
                && dropCollectionsOnFinish == that.dropCollectionsOnFinish
                && metricsEnabled == that.metricsEnabled
                && services.equals(that.services) && fuzzSettings.equals(that.fuzzSettings)
                && comparisonPolicy.equals(that.comparisonPolicy) && healthMode == that.healthMode
                && Objects.equals(resultsFile, that.resultsFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(services, fuzzSettings, comparisonPolicy, healthMode, callTimeoutMillis, testCount, batchSize);
    }

    public static final class Builder {
        private List<ServiceConfig> services;
        private FuzzSettings fuzzSettings;
        private ComparisonPolicy comparisonPolicy;
        private HealthMode healthMode;
        private Long healthReprobeIntervalMillis;
        private Long callTimeoutMillis;
        private Long healthProbeTimeoutMillis;
        private Integer testCount;
        private Integer batchSize;
        private Integer dispatcherThreads;
        private String resultsFile;
        private Boolean dropCollectionsOnFinish;
        private Boolean metricsEnabled;

        public Builder services(List<ServiceConfig> services) {
            this.services = Objects.requireNonNull(services, "services");
            return this;
        }

        public Builder service(ServiceConfig service) {
            if (services == null) services = new ArrayList<>();
            else services = new ArrayList<>(services);
            services.add(Objects.requireNonNull(service, "service"));
            return this;
        }

        public Builder fuzzSettings(FuzzSettings fuzzSettings) {
            this.fuzzSettings = fuzzSettings;
            return this;
        }

        public Builder comparisonPolicy(ComparisonPolicy comparisonPolicy) {
            this.comparisonPolicy = comparisonPolicy;
            return this;
        }

        public Builder healthMode(HealthMode healthMode) {
            this.healthMode = healthMode;
            return this;
        }

        public Builder healthReprobeIntervalMillis(long millis) {
            this.healthReprobeIntervalMillis = millis;
            return this;
        }

        public Builder callTimeoutMillis(long millis) {
            this.callTimeoutMillis = millis;
            return this;
        }

        public Builder healthProbeTimeoutMillis(long millis) {
            this.healthProbeTimeoutMillis = millis;
            return this;
        }

        public Builder testCount(int testCount) {
            this.testCount = testCount;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder dispatcherThreads(int threads) {
            this.dispatcherThreads = threads;
            return this;
        }

        public Builder resultsFile(String resultsFile) {
            this.resultsFile = resultsFile;
            return this;
        }

        public Builder dropCollectionsOnFinish(boolean drop) {
            this.dropCollectionsOnFinish = drop;
            return this;
        }

        public Builder metricsEnabled(boolean enabled) {
            this.metricsEnabled = enabled;
            return this;
        }

        public FuzzerConfig build() {
            return new FuzzerConfig(services, fuzzSettings, comparisonPolicy, healthMode, healthReprobeIntervalMillis,
                    callTimeoutMillis, healthProbeTimeoutMillis, testCount, batchSize, dispatcherThreads, resultsFile,
                    dropCollectionsOnFinish, metricsEnabled);
        }
    }
}
