package com.memorybench.provider;

import java.util.Map;

/** Optional {@code update_memory} operation. */
public interface UpdateMemoryOperation extends ProviderAdapter {

    MemoryRecord updateMemory(ScopeContext scope, String memoryId, String content, Map<String, Object> metadata)
            throws Exception;
}
