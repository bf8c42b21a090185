package com.memorybench.registry;

import java.util.Objects;

/**
 * Non-fatal problem found while loading one provider. The provider may still be registered.
 *
 * @param provider provider name, or its directory when the name is unknown
 */
public record ProviderLoadWarning(String provider, Code code, String message) {

    public enum Code {
        /** Adapter module present but no {@code manifest.json}; the directory is skipped. */
        MISSING_MANIFEST,
        /** Adapter implements an optional operation its manifest does not declare. */
        CAPABILITY_MISMATCH,
        /** Declared convergence wait above the configured threshold. */
        HIGH_CONVERGENCE_WAIT
    }

    public ProviderLoadWarning {
        Objects.requireNonNull(code, "code");
        provider = provider != null ? provider : "";
        message = message != null ? message : "";
    }

    /** {@code warning [CODE] provider: message}. */
    public String format() {
        return "warning [" + code + "] " + provider + ": " + message;
    }
}
