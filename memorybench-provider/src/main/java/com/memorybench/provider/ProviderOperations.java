package com.memorybench.provider;

import com.memorybench.capability.OptionalOperation;
import com.memorybench.capability.ProviderCapabilities;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch helpers for optional operations. Callers that do not know an adapter's concrete type
 * use these instead of casting; a missing operation raises
 * {@link UnsupportedProviderOperationException} naming the provider and the operation.
 */
public final class ProviderOperations {

    private ProviderOperations() {
    }

    /** Optional operations {@code adapter} implements. */
    public static Set<OptionalOperation> implementedOptionalOperations(ProviderAdapter adapter) {
        EnumSet<OptionalOperation> ops = EnumSet.noneOf(OptionalOperation.class);
        for (OptionalOperation op : OptionalOperation.values()) {
            if (supports(adapter, op)) ops.add(op);
        }
        return ops;
    }

    public static boolean supports(ProviderAdapter adapter, OptionalOperation op) {
        switch (op) {
            case UPDATE_MEMORY:
                return adapter instanceof UpdateMemoryOperation;
            case LIST_MEMORIES:
                return adapter instanceof ListMemoriesOperation;
            case RESET_SCOPE:
                return adapter instanceof ResetScopeOperation;
            case GET_CAPABILITIES:
                return adapter instanceof GetCapabilitiesOperation;
            default:
                return false;
        }
    }

    public static MemoryRecord updateMemory(ProviderAdapter adapter, ScopeContext scope, String memoryId,
                                            String content, Map<String, Object> metadata) throws Exception {
        if (!(adapter instanceof UpdateMemoryOperation)) {
            throw unsupported(adapter, OptionalOperation.UPDATE_MEMORY);
        }
        return ((UpdateMemoryOperation) adapter).updateMemory(scope, memoryId, content, metadata);
    }

    public static List<MemoryRecord> listMemories(ProviderAdapter adapter, ScopeContext scope,
                                                  Integer limit, Integer offset) throws Exception {
        if (!(adapter instanceof ListMemoriesOperation)) {
            throw unsupported(adapter, OptionalOperation.LIST_MEMORIES);
        }
        return ((ListMemoriesOperation) adapter).listMemories(scope, limit, offset);
    }

    public static boolean resetScope(ProviderAdapter adapter, ScopeContext scope) throws Exception {
        if (!(adapter instanceof ResetScopeOperation)) {
            throw unsupported(adapter, OptionalOperation.RESET_SCOPE);
        }
        return ((ResetScopeOperation) adapter).resetScope(scope);
    }

    public static ProviderCapabilities getCapabilities(ProviderAdapter adapter) throws Exception {
        if (!(adapter instanceof GetCapabilitiesOperation)) {
            throw unsupported(adapter, OptionalOperation.GET_CAPABILITIES);
        }
        return ((GetCapabilitiesOperation) adapter).getCapabilities();
    }

    private static UnsupportedProviderOperationException unsupported(ProviderAdapter adapter, OptionalOperation op) {
        return new UnsupportedProviderOperationException(adapter.getName(), op.operationName());
    }
}
