package com.memorybench.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Presents a {@link LegacyProvider} as a {@link ProviderAdapter} without touching the wrapped object.
 * <ul>
 *   <li>{@code addMemory} generates a random UUID and forwards content plus metadata (with
 *       {@code _scope} and {@code _generated_id} added) to {@code addContext}.</li>
 *   <li>{@code retrieveMemory} ignores the scope, maps {@code searchQuery} hits and applies
 *       {@code limit} after mapping; a limit of 0 yields no results.</li>
 *   <li>{@code deleteMemory} always throws {@link UnsupportedProviderOperationException}.</li>
 * </ul>
 * The wrapper's name is the one given at construction (normally the manifest name), not the legacy
 * object's own name. No optional operation is ever exposed.
 */
public final class LegacyProviderWrapper implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(LegacyProviderWrapper.class);

    static final String SCOPE_KEY = "_scope";
    static final String GENERATED_ID_KEY = "_generated_id";

    private final LegacyProvider legacy;
    private final String name;

    public LegacyProviderWrapper(LegacyProvider legacy, String name) {
        this.legacy = Objects.requireNonNull(legacy, "legacy");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String getName() {
        return name;
    }

    /** The wrapped provider. */
    public LegacyProvider getLegacy() {
        return legacy;
    }

    @Override
    public MemoryRecord addMemory(ScopeContext scope, String content, Map<String, Object> metadata) throws Exception {
        String id = UUID.randomUUID().toString();
        Map<String, Object> packaged = new LinkedHashMap<>();
        if (metadata != null) packaged.putAll(metadata);
        packaged.put(SCOPE_KEY, scope.toMap());
        packaged.put(GENERATED_ID_KEY, id);
        legacy.addContext(new PreparedData(content, packaged));
        log.debug("Legacy provider {} stored memory {}", name, id);
        return new MemoryRecord(id, content, metadata, System.currentTimeMillis());
    }

    @Override
    public List<RetrievalItem> retrieveMemory(ScopeContext scope, String query, Integer limit) throws Exception {
        List<LegacySearchResult> hits = legacy.searchQuery(query);
        if (hits == null) return List.of();
        long now = System.currentTimeMillis();
        List<RetrievalItem> items = new ArrayList<>(hits.size());
        for (LegacySearchResult hit : hits) {
            String id = hit.id() != null ? hit.id() : "";
            items.add(new RetrievalItem(new MemoryRecord(id, hit.context(), null, now), hit.score()));
        }
        if (limit != null && limit >= 0 && limit < items.size()) {
            return List.copyOf(items.subList(0, limit));
        }
        return List.copyOf(items);
    }

    @Override
    public boolean deleteMemory(ScopeContext scope, String memoryId) {
        throw new UnsupportedProviderOperationException(name, "delete_memory");
    }

    @Override
    public String toString() {
        return "LegacyProviderWrapper{" + name + "}";
    }
}
