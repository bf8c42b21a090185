package com.memorybench.registry;

import java.util.Objects;

/** An adapter module could not be turned into an adapter object. */
public class AdapterLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ProviderLoadError.Code code;

    public AdapterLoadException(ProviderLoadError.Code code, String message) {
        this(code, message, null);
    }

    public AdapterLoadException(ProviderLoadError.Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    /** Error code the registry records for this failure. */
    public ProviderLoadError.Code getCode() {
        return code;
    }
}
