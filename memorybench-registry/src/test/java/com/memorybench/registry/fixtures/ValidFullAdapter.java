package com.memorybench.registry.fixtures;

import com.memorybench.capability.CoreOperations;
import com.memorybench.capability.IntelligenceFlags;
import com.memorybench.capability.OptionalOperation;
import com.memorybench.capability.OptionalOperations;
import com.memorybench.capability.ProviderCapabilities;
import com.memorybench.capability.SystemFlags;
import com.memorybench.provider.GetCapabilitiesOperation;
import com.memorybench.provider.ListMemoriesOperation;
import com.memorybench.provider.MemoryRecord;
import com.memorybench.provider.ResetScopeOperation;
import com.memorybench.provider.RetrievalItem;
import com.memorybench.provider.ScopeContext;
import com.memorybench.provider.UpdateMemoryOperation;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/** Implements every optional operation. */
public class ValidFullAdapter implements UpdateMemoryOperation, ListMemoriesOperation, ResetScopeOperation,
        GetCapabilitiesOperation {

    @Override
    public String getName() {
        return "valid-full";
    }

    @Override
    public MemoryRecord addMemory(ScopeContext scope, String content, Map<String, Object> metadata) {
        return new MemoryRecord("full-1", content, metadata, 1L);
    }

    @Override
    public List<RetrievalItem> retrieveMemory(ScopeContext scope, String query, Integer limit) {
        return List.of();
    }

    @Override
    public boolean deleteMemory(ScopeContext scope, String memoryId) {
        return false;
    }

    @Override
    public MemoryRecord updateMemory(ScopeContext scope, String memoryId, String content, Map<String, Object> metadata) {
        return new MemoryRecord(memoryId, content, metadata, 2L);
    }

    @Override
    public List<MemoryRecord> listMemories(ScopeContext scope, Integer limit, Integer offset) {
        return List.of();
    }

    @Override
    public boolean resetScope(ScopeContext scope) {
        return true;
    }

    @Override
    public ProviderCapabilities getCapabilities() {
        return new ProviderCapabilities(CoreOperations.all(),
                OptionalOperations.of(EnumSet.allOf(OptionalOperation.class)),
                new SystemFlags(true, 120, 500),
                new IntelligenceFlags(true, true, "knowledge"));
    }
}
