package com.vdbfuzz.generator;

import com.vdbfuzz.config.FuzzSettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Random metadata documents of string, number, boolean, list and nested fields. */
final class MetadataFactory {

    private static final String ALNUM = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final String SPECIAL = ALNUM + "!@#$%^&*()";

    private final FuzzSettings settings;
    private final Random random;

    MetadataFactory(FuzzSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    /** One entry per vector; an entry is null when that vector carries no metadata. */
    List<Map<String, Object>> forVectors(int count) {
        List<Map<String, Object>> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(random.nextDouble() < settings.getProbabilityMetadata() ? next() : null);
        }
        return out;
    }

    Map<String, Object> next() {
        int fields = random.nextInt(settings.getMaxMetadataFields() + 1);
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < fields; i++) {
            String key = "field_" + i;
            switch (random.nextInt(5)) {
                case 0:
                    m.put(key, random.nextDouble() < settings.getProbabilitySpecialChars()
                            ? text(SPECIAL, 1 + random.nextInt(50))
                            : text(ALNUM, 1 + random.nextInt(20)));
                    break;
                case 1:
                    m.put(key, random.nextInt(2_000_001) - 1_000_000);
                    break;
                case 2:
                    m.put(key, random.nextBoolean());
                    break;
                case 3: {
                    List<Integer> list = new ArrayList<>();
                    int n = 1 + random.nextInt(10);
                    for (int j = 0; j < n; j++) list.add(random.nextInt(101));
                    m.put(key, list);
                    break;
                }
                default: {
                    Object[] choices = {"nested_string", 42, Boolean.TRUE};
                    Map<String, Object> nested = new LinkedHashMap<>();
                    nested.put("nested_value", choices[random.nextInt(choices.length)]);
                    m.put(key, nested);
                }
            }
        }
        return m;
    }

    private String text(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        return sb.toString();
    }
}
