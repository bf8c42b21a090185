package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** {@code capabilities.core_operations}: add/retrieve/delete flags. */
public final class CoreOperations extends ExtensibleJsonObject {

    private final boolean addMemory;
    private final boolean retrieveMemory;
    private final boolean deleteMemory;

    @JsonCreator
    public CoreOperations(
            @JsonProperty("add_memory") boolean addMemory,
            @JsonProperty("retrieve_memory") boolean retrieveMemory,
            @JsonProperty("delete_memory") boolean deleteMemory) {
        this.addMemory = addMemory;
        this.retrieveMemory = retrieveMemory;
        this.deleteMemory = deleteMemory;
    }

    /** All three core operations declared. */
    public static CoreOperations all() {
        return new CoreOperations(true, true, true);
    }

    @JsonProperty("add_memory")
    public boolean isAddMemory() {
        return addMemory;
    }

    @JsonProperty("retrieve_memory")
    public boolean isRetrieveMemory() {
        return retrieveMemory;
    }

    @JsonProperty("delete_memory")
    public boolean isDeleteMemory() {
        return deleteMemory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CoreOperations that = (CoreOperations) o;
        return addMemory == that.addMemory && retrieveMemory == that.retrieveMemory
                && deleteMemory == that.deleteMemory
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(addMemory, retrieveMemory, deleteMemory, getExtensions());
    }
}
