package com.memorybench.provider;

import java.util.List;
import java.util.Map;

/**
 * Contract every memory provider adapter implements. An adapter module exposes one instance of this
 * interface; the registry pairs it with the provider's {@code manifest.json}.
 * <p>
 * Optional operations are separate interfaces extending this one ({@link UpdateMemoryOperation},
 * {@link ListMemoriesOperation}, {@link ResetScopeOperation}, {@link GetCapabilitiesOperation}). An
 * operation counts as present exactly when the adapter class implements the corresponding interface,
 * and the manifest must declare it under {@code capabilities.optional_operations}.
 * <p>
 * Operations may block on I/O. Checked failures from the backing service are propagated unchanged.
 */
public interface ProviderAdapter {

    /**
     * Provider name. Must equal {@code provider.name} in the manifest exactly.
     */
    String getName();

    /**
     * Stores a new memory.
     *
     * @param metadata optional key-value metadata; may be null
     * @return the created record, with a provider-generated id
     */
    MemoryRecord addMemory(ScopeContext scope, String content, Map<String, Object> metadata) throws Exception;

    /**
     * Searches memories in {@code scope}.
     *
     * @param limit maximum number of results; null means the provider default
     * @return hits ordered by decreasing relevance
     */
    List<RetrievalItem> retrieveMemory(ScopeContext scope, String query, Integer limit) throws Exception;

    /**
     * Deletes one memory.
     *
     * @return true if deleted, false if no memory had that id
     */
    boolean deleteMemory(ScopeContext scope, String memoryId) throws Exception;
}
