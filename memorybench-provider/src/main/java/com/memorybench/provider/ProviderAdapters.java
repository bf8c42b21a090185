package com.memorybench.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns a loaded adapter object into a {@link ProviderAdapter}, wrapping legacy providers. */
public final class ProviderAdapters {

    private static final Logger log = LoggerFactory.getLogger(ProviderAdapters.class);

    private ProviderAdapters() {
    }

    /**
     * Returns {@code candidate} itself if it satisfies the current contract, or a
     * {@link LegacyProviderWrapper} named {@code declaredName} if it satisfies the legacy one.
     *
     * @param declaredName name the wrapper reports; normally the manifest's {@code provider.name}
     * @throws IllegalArgumentException if {@code candidate} satisfies neither contract
     */
    public static ProviderAdapter asCurrentContract(Object candidate, String declaredName) {
        AdapterContract contract = AdapterContract.detect(candidate).orElseThrow(() -> new IllegalArgumentException(
                "Object of type " + (candidate == null ? "null" : candidate.getClass().getName())
                        + " implements neither " + ProviderAdapter.class.getSimpleName()
                        + " nor " + LegacyProvider.class.getSimpleName() + " with a non-null name"));
        return asCurrentContract(candidate, contract, declaredName);
    }

    /** Same as {@link #asCurrentContract(Object, String)} with the contract already detected. */
    public static ProviderAdapter asCurrentContract(Object candidate, AdapterContract contract, String declaredName) {
        if (contract == AdapterContract.CURRENT) {
            return (ProviderAdapter) candidate;
        }
        LegacyProvider legacy = (LegacyProvider) candidate;
        String name = declaredName != null ? declaredName : legacy.getName();
        log.debug("Wrapping legacy provider {} as {}", legacy.getName(), name);
        return new LegacyProviderWrapper(legacy, name);
    }
}
