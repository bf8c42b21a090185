package com.memorybench.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One stored memory as returned by an adapter.
 *
 * @param timestamp creation time, epoch milliseconds
 */
public record MemoryRecord(String id, String context, Map<String, Object> metadata, long timestamp) {

    public MemoryRecord {
        Objects.requireNonNull(id, "id");
        context = context != null ? context : "";
        metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
