package com.memorybench.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds provider files under {@code <baseDir>/providers}. Only that directory tree is scanned.
 * File names match case-sensitively; every result is absolute and sorted, so registration order
 * does not depend on the file system.
 */
public final class ProviderDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ProviderDiscovery.class);

    public static final String PROVIDERS_DIR = "providers";
    public static final String MANIFEST_FILE = "manifest.json";
    public static final String ADAPTER_MODULE_PREFIX = "index.";

    private ProviderDiscovery() {
    }

    /** Every {@code manifest.json} below {@code baseDir/providers}. */
    public static List<Path> discoverManifests(Path baseDir) {
        return walk(providersDir(baseDir), ProviderDiscovery::isManifest);
    }

    /** Every {@code index.*} file below {@code baseDir/providers}. */
    public static List<Path> discoverAdapterModules(Path baseDir) {
        return walk(providersDir(baseDir), ProviderDiscovery::isAdapterModule);
    }

    /**
     * Groups manifests and adapter modules by their parent directory.
     *
     * @return one candidate per directory holding either file, sorted by directory
     * @throws ProvidersDirectoryNotFoundException if {@code baseDir/providers} is missing
     */
    public static List<ProviderCandidate> discoverCandidates(Path baseDir) {
        Path root = providersDir(baseDir);
        List<Path> files = walk(root, p -> isManifest(p) || isAdapterModule(p));

        Map<Path, List<Path>> byDirectory = new TreeMap<>();
        for (Path file : files) {
            byDirectory.computeIfAbsent(file.getParent(), d -> new ArrayList<>()).add(file);
        }
        List<ProviderCandidate> candidates = new ArrayList<>(byDirectory.size());
        for (Map.Entry<Path, List<Path>> e : byDirectory.entrySet()) {
            Path manifest = null;
            List<Path> modules = new ArrayList<>();
            for (Path file : e.getValue()) {
                if (isManifest(file)) {
                    manifest = file;
                } else {
                    modules.add(file);
                }
            }
            candidates.add(new ProviderCandidate(e.getKey(), manifest, modules));
        }
        log.debug("Discovered {} provider candidate(s) under {}", candidates.size(), root);
        return candidates;
    }

    /**
     * Absolute {@code baseDir/providers}.
     *
     * @throws ProvidersDirectoryNotFoundException if it is missing or not a directory
     */
    public static Path providersDir(Path baseDir) {
        Path root = baseDir.toAbsolutePath().normalize().resolve(PROVIDERS_DIR);
        if (!Files.isDirectory(root)) {
            throw new ProvidersDirectoryNotFoundException(root);
        }
        return root;
    }

    static boolean isManifest(Path file) {
        return MANIFEST_FILE.equals(String.valueOf(file.getFileName()));
    }

    static boolean isAdapterModule(Path file) {
        String name = String.valueOf(file.getFileName());
        return name.startsWith(ADAPTER_MODULE_PREFIX) && name.length() > ADAPTER_MODULE_PREFIX.length();
    }

    private static List<Path> walk(Path root, Predicate<Path> filter) {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(filter)
                    .map(Path::toAbsolutePath)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan providers directory " + root, e);
        }
    }
}
