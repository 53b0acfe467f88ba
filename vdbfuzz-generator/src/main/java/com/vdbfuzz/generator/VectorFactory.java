package com.vdbfuzz.generator;

import com.vdbfuzz.config.FuzzSettings;
import com.vdbfuzz.model.Vector;

import java.util.Random;

/**
 * Fuzzed vectors: dimension from the configured range with low-probability empty and oversized
 * branches; components in [-1, 1], sometimes [-10, 10], and rarely one of 0.0, NaN, +Inf, -Inf.
 */
final class VectorFactory {

    private static final float[] EDGE_COMPONENTS = {0.0f, Float.NaN, Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY};

    private final FuzzSettings settings;
    private final Random random;

    VectorFactory(FuzzSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    Vector next() {
        double branch = random.nextDouble();
        if (branch < settings.getProbabilityEmptyVector()) {
            return Vector.of();
        }
        int dimension;
        if (branch < settings.getProbabilityEmptyVector() + settings.getProbabilityOversizedVector()
                && settings.getMaxOversizedDimension() > settings.getMaxDimension()) {
            dimension = between(settings.getMaxDimension() + 1, settings.getMaxOversizedDimension());
        } else {
            dimension = between(settings.getMinDimension(), settings.getMaxDimension());
        }
        return random(dimension, settings.getProbabilityWideRange(), settings.getProbabilityEdgeComponent());
    }

    /** Well-formed vector of the collection dimension with components in [-1, 1]. */
    Vector regular() {
        return random(settings.getVectorDimension(), 0.0, 0.0);
    }

    Vector random(int dimension, double wideRange, double edge) {
        float[] c = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            if (edge > 0 && random.nextDouble() < edge) {
                c[i] = EDGE_COMPONENTS[random.nextInt(EDGE_COMPONENTS.length)];
            } else {
                float bound = wideRange > 0 && random.nextDouble() < wideRange ? 10f : 1f;
                c[i] = (random.nextFloat() * 2f - 1f) * bound;
            }
        }
        return new Vector(c);
    }

    /** Collection-dimension vector where every tenth component is {@code special}. */
    Vector withEvery10th(float special) {
        float[] c = regular().toArray();
        for (int i = 0; i < c.length; i += 10) c[i] = special;
        return new Vector(c);
    }

    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
