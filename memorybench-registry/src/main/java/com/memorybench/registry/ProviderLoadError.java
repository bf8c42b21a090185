package com.memorybench.registry;

import java.util.Objects;

/**
 * Problem that kept one provider out of the registry. Other providers are unaffected.
 *
 * @param provider provider name, or its directory when the name is unknown
 * @param cause    underlying exception, or null
 */
public record ProviderLoadError(String provider, Code code, String message, Throwable cause) {

    public enum Code {
        INVALID_MANIFEST,
        MISSING_ADAPTER,
        IMPORT_FAILED,
        INVALID_INTERFACE,
        INITIALIZATION_FAILED,
        NAME_MISMATCH,
        MISSING_DECLARED_METHOD,
        DUPLICATE_NAME
    }

    public ProviderLoadError {
        Objects.requireNonNull(code, "code");
        provider = provider != null ? provider : "";
        message = message != null ? message : "";
    }

    public ProviderLoadError(String provider, Code code, String message) {
        this(provider, code, message, null);
    }

    /** {@code error [CODE] provider: message}. */
    public String format() {
        return "error [" + code + "] " + provider + ": " + message;
    }
}
