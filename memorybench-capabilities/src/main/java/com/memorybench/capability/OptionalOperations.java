package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@code capabilities.optional_operations}. Each flag is optional; null means the manifest does not
 * mention the operation. Unknown operation keys are kept as extensions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OptionalOperations extends ExtensibleJsonObject {

    private final Boolean updateMemory;
    private final Boolean listMemories;
    private final Boolean resetScope;
    private final Boolean getCapabilities;

    @JsonCreator
    public OptionalOperations(
            @JsonProperty("update_memory") Boolean updateMemory,
            @JsonProperty("list_memories") Boolean listMemories,
            @JsonProperty("reset_scope") Boolean resetScope,
            @JsonProperty("get_capabilities") Boolean getCapabilities) {
        this.updateMemory = updateMemory;
        this.listMemories = listMemories;
        this.resetScope = resetScope;
        this.getCapabilities = getCapabilities;
    }

    /** No optional operation mentioned. */
    public static OptionalOperations none() {
        return new OptionalOperations(null, null, null, null);
    }

    /** Declares exactly the given operations as {@code true}; others are left unset. */
    public static OptionalOperations of(Set<OptionalOperation> declared) {
        Set<OptionalOperation> ops = declared != null && !declared.isEmpty()
                ? EnumSet.copyOf(declared) : EnumSet.noneOf(OptionalOperation.class);
        return new OptionalOperations(
                ops.contains(OptionalOperation.UPDATE_MEMORY) ? Boolean.TRUE : null,
                ops.contains(OptionalOperation.LIST_MEMORIES) ? Boolean.TRUE : null,
                ops.contains(OptionalOperation.RESET_SCOPE) ? Boolean.TRUE : null,
                ops.contains(OptionalOperation.GET_CAPABILITIES) ? Boolean.TRUE : null);
    }

    @JsonProperty("update_memory")
    public Boolean getUpdateMemory() {
        return updateMemory;
    }

    @JsonProperty("list_memories")
    public Boolean getListMemories() {
        return listMemories;
    }

    @JsonProperty("reset_scope")
    public Boolean getResetScope() {
        return resetScope;
    }

    @JsonProperty("get_capabilities")
    public Boolean getGetCapabilities() {
        return getCapabilities;
    }

    /** Operations declared {@code true}. */
    public Set<OptionalOperation> declared() {
        Set<OptionalOperation> out = EnumSet.noneOf(OptionalOperation.class);
        for (OptionalOperation op : OptionalOperation.values()) {
            if (op.isDeclaredBy(this)) out.add(op);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OptionalOperations that = (OptionalOperations) o;
        return Objects.equals(updateMemory, that.updateMemory) && Objects.equals(listMemories, that.listMemories)
                && Objects.equals(resetScope, that.resetScope) && Objects.equals(getCapabilities, that.getCapabilities)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(updateMemory, listMemories, resetScope, getCapabilities, getExtensions());
    }
}
