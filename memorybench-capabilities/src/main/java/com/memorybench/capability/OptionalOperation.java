package com.memorybench.capability;

import java.util.Optional;

/**
 * Operations an adapter may implement. A manifest declares them under
 * {@code capabilities.optional_operations}; the registry checks declarations against the adapter.
 */
public enum OptionalOperation {

    UPDATE_MEMORY("update_memory"),
    LIST_MEMORIES("list_memories"),
    RESET_SCOPE("reset_scope"),
    GET_CAPABILITIES("get_capabilities");

    private final String operationName;

    OptionalOperation(String operationName) {
        this.operationName = operationName;
    }

    /** Manifest key and error-message name, e.g. {@code update_memory}. */
    public String operationName() {
        return operationName;
    }

    /**
     * True only when the manifest declares this operation as {@code true}; absent and {@code false}
     * both mean "not declared".
     */
    public boolean isDeclaredBy(OptionalOperations ops) {
        if (ops == null) return false;
        Boolean declared;
        switch (this) {
            case UPDATE_MEMORY:
                declared = ops.getUpdateMemory();
                break;
            case LIST_MEMORIES:
                declared = ops.getListMemories();
                break;
            case RESET_SCOPE:
                declared = ops.getResetScope();
                break;
            case GET_CAPABILITIES:
                declared = ops.getGetCapabilities();
                break;
            default:
                declared = null;
        }
        return Boolean.TRUE.equals(declared);
    }

    public static Optional<OptionalOperation> fromOperationName(String name) {
        if (name == null) return Optional.empty();
        for (OptionalOperation op : values()) {
            if (op.operationName.equals(name.trim())) return Optional.of(op);
        }
        return Optional.empty();
    }
}
