package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.memorybench.capability.ExtensibleJsonObject;

import java.util.Objects;

/** {@code semantic_properties}: how updates and deletes become visible. */
public final class SemanticProperties extends ExtensibleJsonObject {

    private final UpdateStrategy updateStrategy;
    private final DeleteStrategy deleteStrategy;

    @JsonCreator
    public SemanticProperties(
            @JsonProperty("update_strategy") UpdateStrategy updateStrategy,
            @JsonProperty("delete_strategy") DeleteStrategy deleteStrategy) {
        this.updateStrategy = updateStrategy;
        this.deleteStrategy = deleteStrategy;
    }

    @JsonProperty("update_strategy")
    public UpdateStrategy getUpdateStrategy() {
        return updateStrategy;
    }

    @JsonProperty("delete_strategy")
    public DeleteStrategy getDeleteStrategy() {
        return deleteStrategy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SemanticProperties that = (SemanticProperties) o;
        return updateStrategy == that.updateStrategy && deleteStrategy == that.deleteStrategy
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(updateStrategy, deleteStrategy, getExtensions());
    }
}
