package com.vdbfuzz.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Picks one of a fixed set of values with probability proportional to its weight. */
final class WeightedChoice<T> {

    private final List<T> values = new ArrayList<>();
    private final double[] cumulative;
    private final double total;

    /** Entries with a weight of zero are never picked. */
    WeightedChoice(Map<T, Double> weights) {
        List<Double> sums = new ArrayList<>();
        double sum = 0;
        for (Map.Entry<T, Double> e : weights.entrySet()) {
            double w = e.getValue() != null ? e.getValue() : 0.0;
            if (w <= 0) continue;
            sum += w;
            values.add(e.getKey());
            sums.add(sum);
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("At least one positive weight is required");
        }
        cumulative = new double[sums.size()];
        for (int i = 0; i < cumulative.length; i++) cumulative[i] = sums.get(i);
        total = sum;
    }

    T pick(Random random) {
        double r = random.nextDouble() * total;
        for (int i = 0; i < cumulative.length; i++) {
            if (r < cumulative[i]) return values.get(i);
        }
        return values.get(values.size() - 1);
    }

    boolean canPick(T value) {
        return values.contains(value);
    }
}
