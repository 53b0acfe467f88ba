package com.vdbfuzz.adapter;

import com.vdbfuzz.config.FuzzerConfig;
import com.vdbfuzz.model.Metric;

import java.time.Duration;
import java.util.Objects;

/** Run-wide settings every adapter receives at creation. */
public final class AdapterOptions {

    private final Duration callTimeout;
    private final Duration probeTimeout;
    private final Metric collectionMetric;

    public AdapterOptions(Duration callTimeout, Duration probeTimeout, Metric collectionMetric) {
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
        this.collectionMetric = collectionMetric != null ? collectionMetric : Metric.L2;
    }

    public static AdapterOptions from(FuzzerConfig config) {
        return new AdapterOptions(
                Duration.ofMillis(config.getCallTimeoutMillis()),
                Duration.ofMillis(config.getHealthProbeTimeoutMillis()),
                config.getFuzzSettings().getCollectionMetric());
    }

    /** Deadline of one request on the data path. */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    /** Deadline of one health probe request; also the TCP connect timeout. */
    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    /** Metric collections are created with. */
    public Metric getCollectionMetric() {
        return collectionMetric;
    }
}
