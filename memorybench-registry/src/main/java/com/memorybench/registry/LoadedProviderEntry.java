package com.memorybench.registry;

import com.memorybench.manifest.ProviderManifest;
import com.memorybench.provider.AdapterContract;
import com.memorybench.provider.ProviderAdapter;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A registered provider: adapter (legacy providers already wrapped), its validated manifest and
 * where it was found.
 *
 * @param path         absolute provider directory
 * @param contract     contract the loaded module satisfied before any wrapping
 * @param manifestHash SHA-256 of the canonical manifest JSON
 */
public record LoadedProviderEntry(ProviderAdapter adapter, ProviderManifest manifest, Path path,
                                  AdapterContract contract, String manifestHash) {

    public LoadedProviderEntry {
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(contract, "contract");
    }

    /** Registered name, equal to {@code manifest.provider.name}. */
    public String name() {
        return manifest.providerName();
    }

    public boolean isLegacy() {
        return contract == AdapterContract.LEGACY;
    }
}
