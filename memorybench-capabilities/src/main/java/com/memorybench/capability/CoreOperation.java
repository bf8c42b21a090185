package com.memorybench.capability;

/**
 * Operations every provider adapter must implement. The operation name is the snake_case key used in
 * manifests and in error messages.
 */
public enum CoreOperation {

    ADD_MEMORY("add_memory"),
    RETRIEVE_MEMORY("retrieve_memory"),
    DELETE_MEMORY("delete_memory");

    private final String operationName;

    CoreOperation(String operationName) {
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }

    /** True if {@code ops} declares this operation. */
    public boolean isDeclaredBy(CoreOperations ops) {
        if (ops == null) return false;
        switch (this) {
            case ADD_MEMORY:
                return ops.isAddMemory();
            case RETRIEVE_MEMORY:
                return ops.isRetrieveMemory();
            case DELETE_MEMORY:
                return ops.isDeleteMemory();
            default:
                return false;
        }
    }
}
