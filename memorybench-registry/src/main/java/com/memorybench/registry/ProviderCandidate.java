package com.memorybench.registry;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One directory under {@code providers/} holding a manifest, an adapter module, or both.
 *
 * @param directory      absolute provider directory
 * @param manifestPath   {@code manifest.json} in that directory, or null
 * @param adapterModules {@code index.*} files in that directory, sorted
 */
public record ProviderCandidate(Path directory, Path manifestPath, List<Path> adapterModules) {

    public ProviderCandidate {
        Objects.requireNonNull(directory, "directory");
        adapterModules = adapterModules == null ? List.of() : List.copyOf(adapterModules);
    }

    public Optional<Path> manifest() {
        return Optional.ofNullable(manifestPath);
    }

    public boolean hasAdapterModule() {
        return !adapterModules.isEmpty();
    }

    /** Directory name, used to label warnings when no manifest name is known. */
    public String label() {
        Path name = directory.getFileName();
        return name != null ? name.toString() : directory.toString();
    }
}
