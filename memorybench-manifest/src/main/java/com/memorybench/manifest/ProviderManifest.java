package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.memorybench.capability.ExtensibleJsonObject;
import com.memorybench.capability.ProviderCapabilities;

import java.util.Objects;

/**
 * Declarative description of a provider, read from {@code providers/<dir>/manifest.json}.
 * Instances are only produced from JSON that passed {@link ManifestValidator}; unknown fields at any
 * level are kept and written back by {@link ManifestJson}.
 */
public final class ProviderManifest extends ExtensibleJsonObject {

    private final String manifestVersion;
    private final ProviderInfo provider;
    private final ProviderCapabilities capabilities;
    private final SemanticProperties semanticProperties;
    private final ConformanceTests conformanceTests;

    @JsonCreator
    public ProviderManifest(
            @JsonProperty("manifest_version") String manifestVersion,
            @JsonProperty("provider") ProviderInfo provider,
            @JsonProperty("capabilities") ProviderCapabilities capabilities,
            @JsonProperty("semantic_properties") SemanticProperties semanticProperties,
            @JsonProperty("conformance_tests") ConformanceTests conformanceTests) {
        this.manifestVersion = manifestVersion;
        this.provider = Objects.requireNonNull(provider, "provider");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.semanticProperties = Objects.requireNonNull(semanticProperties, "semanticProperties");
        this.conformanceTests = Objects.requireNonNull(conformanceTests, "conformanceTests");
    }

    @JsonProperty("manifest_version")
    public String getManifestVersion() {
        return manifestVersion;
    }

    @JsonProperty("provider")
    public ProviderInfo getProvider() {
        return provider;
    }

    @JsonProperty("capabilities")
    public ProviderCapabilities getCapabilities() {
        return capabilities;
    }

    @JsonProperty("semantic_properties")
    public SemanticProperties getSemanticProperties() {
        return semanticProperties;
    }

    @JsonProperty("conformance_tests")
    public ConformanceTests getConformanceTests() {
        return conformanceTests;
    }

    /** Shortcut for {@code provider.name}. */
    public String providerName() {
        return provider.getName();
    }

    public UpdateStrategy updateStrategy() {
        return semanticProperties.getUpdateStrategy();
    }

    public DeleteStrategy deleteStrategy() {
        return semanticProperties.getDeleteStrategy();
    }

    /** Shortcut for {@code conformance_tests.expected_behavior.convergence_wait_ms}. */
    public int convergenceWaitMs() {
        return conformanceTests.getExpectedBehavior().getConvergenceWaitMs();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderManifest that = (ProviderManifest) o;
        return Objects.equals(manifestVersion, that.manifestVersion) && provider.equals(that.provider)
                && capabilities.equals(that.capabilities) && semanticProperties.equals(that.semanticProperties)
                && conformanceTests.equals(that.conformanceTests)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(manifestVersion, provider, capabilities, semanticProperties, conformanceTests, getExtensions());
    }

    @Override
    public String toString() {
        return "ProviderManifest{" + provider.getName() + "@" + provider.getVersion() + "}";
    }
}
