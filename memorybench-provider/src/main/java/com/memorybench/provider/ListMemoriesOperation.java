package com.memorybench.provider;

import java.util.List;

/** Optional {@code list_memories} operation. */
public interface ListMemoriesOperation extends ProviderAdapter {

    /**
     * Lists memories in {@code scope}.
     *
     * @param limit  page size; null for the provider default
     * @param offset records to skip; null for 0
     */
    List<MemoryRecord> listMemories(ScopeContext scope, Integer limit, Integer offset) throws Exception;
}
