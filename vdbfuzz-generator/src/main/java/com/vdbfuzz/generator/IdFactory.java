package com.vdbfuzz.generator;

import com.vdbfuzz.config.FuzzSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Ids of the form {@code id_<n>} from a monotonically increasing counter, with a low-probability
 * malformed branch. Remembers recently issued ids so deletes and duplicates can target data that
 * was inserted earlier in the run.
 */
final class IdFactory {

    static final int REMEMBERED_IDS = 10_000;

    enum Malformed { EMPTY, OVERSIZED, CONTROL_CHARS, DUPLICATE }

    private final FuzzSettings settings;
    private final Random random;
    private final List<String> issued = new ArrayList<>();
    private long counter;

    IdFactory(FuzzSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    String next() {
        if (random.nextDouble() < settings.getProbabilityMalformedId()) {
            return malformed(Malformed.values()[random.nextInt(Malformed.values().length)]);
        }
        return fresh();
    }

    String fresh() {
        String id = "id_" + (counter++);
        remember(id);
        return id;
    }

    /** An id never issued by this factory. */
    String unused() {
        return "id_unused_" + (counter++);
    }

    String malformed(Malformed kind) {
        switch (kind) {
            case EMPTY:
                return "";
            case OVERSIZED: {
                StringBuilder sb = new StringBuilder(settings.getOversizedIdLength());
                while (sb.length() < settings.getOversizedIdLength()) sb.append((char) ('a' + random.nextInt(26)));
                return sb.toString();
            }
            case CONTROL_CHARS:
                return "id_\u0000\n\t_" + (counter++);
            case DUPLICATE:
            default:
                return issued.isEmpty() ? "" : previouslyIssued();
        }
    }

    /** Random id among those remembered; falls back to a fresh one when none was issued yet. */
    String previouslyIssued() {
        if (issued.isEmpty()) return fresh();
        return issued.get(random.nextInt(issued.size()));
    }

    boolean hasIssued() {
        return !issued.isEmpty();
    }

    private void remember(String id) {
        if (issued.size() >= REMEMBERED_IDS) {
            issued.set(random.nextInt(REMEMBERED_IDS), id);
        } else {
            issued.add(id);
        }
    }
}
