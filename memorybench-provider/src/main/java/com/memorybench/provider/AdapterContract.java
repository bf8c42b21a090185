package com.memorybench.provider;

import java.util.Optional;

/**
 * Which contract a loaded adapter object satisfies. Decided once at load time and stored with the
 * registry entry; callers never re-inspect the object.
 */
public enum AdapterContract {

    /** Implements {@link ProviderAdapter} directly. */
    CURRENT,

    /** Implements {@link LegacyProvider}; served through {@link LegacyProviderWrapper}. */
    LEGACY;

    /**
     * Classifies {@code candidate}. The current contract is tested first; the two contracts share no
     * operation, so at most one applies to a conforming object. A null name fails both.
     *
     * @return empty if the object satisfies neither contract
     */
    public static Optional<AdapterContract> detect(Object candidate) {
        if (candidate instanceof ProviderAdapter && ((ProviderAdapter) candidate).getName() != null) {
            return Optional.of(CURRENT);
        }
        if (candidate instanceof LegacyProvider && ((LegacyProvider) candidate).getName() != null) {
            return Optional.of(LEGACY);
        }
        return Optional.empty();
    }
}
