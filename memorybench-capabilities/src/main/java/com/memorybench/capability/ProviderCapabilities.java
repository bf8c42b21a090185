package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * What a provider can do: {@code capabilities} in a manifest, and the value returned by an adapter's
 * {@code get_capabilities} operation.
 */
public final class ProviderCapabilities extends ExtensibleJsonObject {

    private final CoreOperations coreOperations;
    private final OptionalOperations optionalOperations;
    private final SystemFlags systemFlags;
    private final IntelligenceFlags intelligenceFlags;

    @JsonCreator
    public ProviderCapabilities(
            @JsonProperty("core_operations") CoreOperations coreOperations,
            @JsonProperty("optional_operations") OptionalOperations optionalOperations,
            @JsonProperty("system_flags") SystemFlags systemFlags,
            @JsonProperty("intelligence_flags") IntelligenceFlags intelligenceFlags) {
        this.coreOperations = Objects.requireNonNull(coreOperations, "coreOperations");
        this.optionalOperations = optionalOperations != null ? optionalOperations : OptionalOperations.none();
        this.systemFlags = Objects.requireNonNull(systemFlags, "systemFlags");
        this.intelligenceFlags = Objects.requireNonNull(intelligenceFlags, "intelligenceFlags");
    }

    @JsonProperty("core_operations")
    public CoreOperations getCoreOperations() {
        return coreOperations;
    }

    @JsonProperty("optional_operations")
    public OptionalOperations getOptionalOperations() {
        return optionalOperations;
    }

    @JsonProperty("system_flags")
    public SystemFlags getSystemFlags() {
        return systemFlags;
    }

    @JsonProperty("intelligence_flags")
    public IntelligenceFlags getIntelligenceFlags() {
        return intelligenceFlags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderCapabilities that = (ProviderCapabilities) o;
        return coreOperations.equals(that.coreOperations) && optionalOperations.equals(that.optionalOperations)
                && systemFlags.equals(that.systemFlags) && intelligenceFlags.equals(that.intelligenceFlags)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(coreOperations, optionalOperations, systemFlags, intelligenceFlags, getExtensions());
    }
}
