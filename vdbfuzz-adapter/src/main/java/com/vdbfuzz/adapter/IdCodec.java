package com.vdbfuzz.adapter;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic translation of caller ids for services whose point ids must be UUIDs. The caller id
 * is stored alongside the point (payload / property {@link #ORIGINAL_ID_FIELD}) so search results
 * can be mapped back.
 */
public final class IdCodec {

    public static final String ORIGINAL_ID_FIELD = "vdbfuzz_id";

    private IdCodec() {
    }

    /** Name-based (v3) UUID of the id; equal ids always map to the same UUID. */
    public static String toUuid(String id) {
        String value = id != null ? id : "";
        return UUID.nameUUIDFromBytes(("vdbfuzz:" + value).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
