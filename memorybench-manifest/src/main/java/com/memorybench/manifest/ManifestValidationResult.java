package com.memorybench.manifest;

import java.util.Objects;

/**
 * Outcome of validating one manifest: either the typed {@link ProviderManifest} or the collected
 * {@link ManifestValidationError}.
 */
public final class ManifestValidationResult {

    private final ProviderManifest manifest;
    private final ManifestValidationError error;

    private ManifestValidationResult(ProviderManifest manifest, ManifestValidationError error) {
        this.manifest = manifest;
        this.error = error;
    }

    public static ManifestValidationResult success(ProviderManifest manifest) {
        return new ManifestValidationResult(Objects.requireNonNull(manifest, "manifest"), null);
    }

    public static ManifestValidationResult failure(ManifestValidationError error) {
        return new ManifestValidationResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isValid() {
        return manifest != null;
    }

    /** The manifest; null when invalid. */
    public ProviderManifest getManifest() {
        return manifest;
    }

    /** The error; null when valid. */
    public ManifestValidationError getError() {
        return error;
    }
}
