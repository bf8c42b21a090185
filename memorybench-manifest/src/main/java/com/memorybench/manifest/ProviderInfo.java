package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.memorybench.capability.ExtensibleJsonObject;

import java.util.Objects;

/** {@code provider}: identification metadata. The name is the registry key. */
public final class ProviderInfo extends ExtensibleJsonObject {

    private final String name;
    private final ProviderType type;
    private final String version;

    @JsonCreator
    public ProviderInfo(
            @JsonProperty("name") String name,
            @JsonProperty("type") ProviderType type,
            @JsonProperty("version") String version) {
        this.name = name;
        this.type = type;
        this.version = version;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public ProviderType getType() {
        return type;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderInfo that = (ProviderInfo) o;
        return Objects.equals(name, that.name) && type == that.type && Objects.equals(version, that.version)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, version, getExtensions());
    }
}
