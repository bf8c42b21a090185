package com.memorybench.registry;

import com.memorybench.capability.OptionalOperation;
import com.memorybench.config.MemoryBenchConfig;
import com.memorybench.manifest.ManifestHasher;
import com.memorybench.manifest.ManifestLoader;
import com.memorybench.manifest.ManifestValidationResult;
import com.memorybench.manifest.ProviderManifest;
import com.memorybench.provider.AdapterContract;
import com.memorybench.provider.ProviderAdapter;
import com.memorybench.provider.ProviderAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of memory providers found under {@code <baseDir>/providers}.
 * <p>
 * {@link #initialize()} discovers provider directories and, for each in sorted order, loads and
 * validates the manifest, loads the adapter module, wraps legacy adapters, checks the adapter name and
 * declared capabilities against the manifest and registers the provider unless its name (compared
 * case-insensitively) is already taken. A bad provider is recorded in the result and skipped; only a
 * missing {@code providers/} directory aborts initialization.
 * <p>
 * Entries are published once at the end of initialization and never mutated afterwards, so lookups
 * need no locking. Construct one registry at startup and pass it to its users; {@link #getInstance(Path)}
 * exists for callers that need a process-wide instance.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private static ProviderRegistry instance;

    private final Path baseDir;
    private final MemoryBenchConfig config;
    private final AdapterLoader adapterLoader;

    private volatile RegistryState state = RegistryState.UNINITIALIZED;
    private volatile ProviderRegistryResult lastResult;
    /** lower-cased name → entry, insertion ordered; replaced wholesale, never mutated */
    private volatile Map<String, LoadedProviderEntry> entries = Collections.emptyMap();

    public ProviderRegistry(Path baseDir) {
        this(baseDir, MemoryBenchConfig.fromEnvironment());
    }

    /**
     * @param baseDir directory containing {@code providers/}; overrides {@link MemoryBenchConfig#getBaseDir()}
     */
    public ProviderRegistry(Path baseDir, MemoryBenchConfig config) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.config = Objects.requireNonNull(config, "config").withBaseDir(baseDir);
        this.adapterLoader = new AdapterLoader(config.getAdapterLoadTimeoutSeconds());
    }

    public ProviderRegistry(MemoryBenchConfig config) {
        this(config.getBaseDir(), config);
    }

    /**
     * Process-wide registry for {@code baseDir}, created and initialized on first call.
     *
     * @throws IllegalStateException               if the instance was created for another base directory
     * @throws ProvidersDirectoryNotFoundException if {@code baseDir/providers} is missing
     */
    public static synchronized ProviderRegistry getInstance(Path baseDir) {
        Path normalized = baseDir.toAbsolutePath().normalize();
        if (instance == null) {
            ProviderRegistry registry = new ProviderRegistry(normalized);
            registry.initialize();
            instance = registry;
        } else if (!instance.baseDir.toAbsolutePath().normalize().equals(normalized)) {
            throw new IllegalStateException("ProviderRegistry already created for " + instance.baseDir
                    + "; call resetInstance() before using " + normalized);
        }
        return instance;
    }

    /** Drops the process-wide instance. */
    public static synchronized void resetInstance() {
        if (instance != null) {
            instance.reset();
            instance = null;
        }
    }

    /**
     * Loads every provider. Runs once; later calls return the cached result until {@link #reset()}.
     *
     * @throws ProvidersDirectoryNotFoundException if {@code baseDir/providers} is missing; the registry
     *                                             stays uninitialized
     * @throws IllegalStateException               if called again while initialization is running on
     *                                             this thread (e.g. from an adapter constructor)
     */
    public synchronized ProviderRegistryResult initialize() {
        if (state == RegistryState.READY) {
            return lastResult;
        }
        if (state == RegistryState.INITIALIZING) {
            throw new IllegalStateException("ProviderRegistry.initialize() re-entered during initialization");
        }
        state = RegistryState.INITIALIZING;
        try {
            ProviderRegistryResult result = loadAll();
            lastResult = result;
            state = RegistryState.READY;
            return result;
        } finally {
            if (state != RegistryState.READY) {
                state = RegistryState.UNINITIALIZED;
            }
        }
    }

    /** Forgets all providers and returns to {@link RegistryState#UNINITIALIZED}. */
    public synchronized void reset() {
        entries = Collections.emptyMap();
        lastResult = null;
        state = RegistryState.UNINITIALIZED;
        adapterLoader.closeCommunityLoaders();
    }

    /** Provider registered under {@code name}, compared case-insensitively. */
    public Optional<LoadedProviderEntry> getProvider(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(entries.get(key(name)));
    }

    /** Registered providers in registration order. */
    public List<LoadedProviderEntry> listProviders() {
        return List.copyOf(entries.values());
    }

    public RegistryState getState() {
        return state;
    }

    /** Result of the last completed {@link #initialize()}, or null. */
    public ProviderRegistryResult getLastResult() {
        return lastResult;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public MemoryBenchConfig getConfig() {
        return config;
    }

    AdapterLoader adapterLoader() {
        return adapterLoader;
    }

    private ProviderRegistryResult loadAll() {
        Path providersDir = ProviderDiscovery.providersDir(baseDir);
        List<ProviderCandidate> candidates = ProviderDiscovery.discoverCandidates(baseDir);

        Map<String, LoadedProviderEntry> loaded = new LinkedHashMap<>();
        List<ProviderLoadWarning> warnings = new ArrayList<>();
        List<ProviderLoadError> errors = new ArrayList<>();
        for (ProviderCandidate candidate : candidates) {
            CandidateLoad load = new CandidateLoad(candidate, relativeLabel(providersDir, candidate), warnings, errors);
            load.run(loaded);
        }

        entries = Collections.unmodifiableMap(loaded);
        ProviderRegistryResult result = new ProviderRegistryResult(new ArrayList<>(loaded.values()), warnings, errors);
        log.info("Providers: {} (dir={})", result.summary(), providersDir);
        return result;
    }

    private static String relativeLabel(Path providersDir, ProviderCandidate candidate) {
        Path relative = providersDir.relativize(candidate.directory());
        String label = relative.toString();
        return label.isEmpty() ? candidate.directory().toString() : label.replace('\\', '/');
    }

    static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /** Pipeline state for one candidate directory. */
    private final class CandidateLoad {

        private final ProviderCandidate candidate;
        private final List<ProviderLoadWarning> warnings;
        private final List<ProviderLoadError> errors;
        private String label;

        CandidateLoad(ProviderCandidate candidate, String label, List<ProviderLoadWarning> warnings,
                      List<ProviderLoadError> errors) {
            this.candidate = candidate;
            this.label = label;
            this.warnings = warnings;
            this.errors = errors;
        }

        void run(Map<String, LoadedProviderEntry> loaded) {
            log.debug("Loading provider candidate {}", candidate.directory());

            if (candidate.manifestPath() == null) {
                warn(ProviderLoadWarning.Code.MISSING_MANIFEST, "No manifest.json in " + candidate.directory()
                        + " (adapter module " + candidate.adapterModules().get(0).getFileName() + " found). Skipping.");
                return;
            }

            ManifestValidationResult validation = ManifestLoader.loadAndValidate(candidate.manifestPath());
            if (!validation.isValid()) {
                error(ProviderLoadError.Code.INVALID_MANIFEST, validation.getError().format(), null);
                return;
            }
            ProviderManifest manifest = validation.getManifest();
            String name = manifest.providerName();
            label = name;

            int convergenceMs = manifest.convergenceWaitMs();
            if (convergenceMs > config.getConvergenceWarnMs()) {
                warn(ProviderLoadWarning.Code.HIGH_CONVERGENCE_WAIT, candidate.manifestPath() + " has convergence_wait_ms="
                        + convergenceMs + "ms (>" + config.getConvergenceWarnMs()
                        + "ms). This may indicate misconfiguration.");
            }

            if (!candidate.hasAdapterModule()) {
                error(ProviderLoadError.Code.MISSING_ADAPTER, "No adapter module (index.properties or index.jar) in "
                        + candidate.directory(), null);
                return;
            }

            AdapterLoader.LoadedAdapter loadedAdapter;
            try {
                Path module = AdapterLoader.selectModule(candidate.adapterModules());
                loadedAdapter = adapterLoader.load(module);
            } catch (AdapterLoadException e) {
                error(e.getCode(), e.getMessage(), e.getCause());
                return;
            }

            // legacy modules are wrapped under the manifest name
            ProviderAdapter adapter = ProviderAdapters.asCurrentContract(loadedAdapter.instance(), loadedAdapter.contract(), name);
            String adapterName = adapter.getName();
            if (!name.equals(adapterName)) {
                error(ProviderLoadError.Code.NAME_MISMATCH, "Adapter name '" + adapterName
                        + "' does not match manifest provider.name '" + name + "' in " + candidate.manifestPath(), null);
                adapterLoader.release(loadedAdapter);
                return;
            }

            CapabilityConformanceChecker.Report report = CapabilityConformanceChecker.check(adapter,
                    manifest.getCapabilities().getOptionalOperations());
            if (config.isWarnUndeclaredCapabilities()) {
                for (OptionalOperation op : report.undeclaredPresent()) {
                    warn(ProviderLoadWarning.Code.CAPABILITY_MISMATCH, "Adapter implements " + op.operationName()
                            + " but the manifest does not declare capabilities.optional_operations."
                            + op.operationName() + " = true");
                }
            }
            if (!report.conforms()) {
                for (OptionalOperation op : report.missingDeclared()) {
                    error(ProviderLoadError.Code.MISSING_DECLARED_METHOD, "Manifest declares "
                            + op.operationName() + " but the adapter does not implement it"
                            + (loadedAdapter.contract() == AdapterContract.LEGACY ? " (legacy providers support no optional operations)" : ""),
                            null);
                }
                adapterLoader.release(loadedAdapter);
                return;
            }

            String key = key(name);
            LoadedProviderEntry existing = loaded.get(key);
            if (existing != null) {
                error(ProviderLoadError.Code.DUPLICATE_NAME, "Provider name '" + name + "' is already registered from "
                        + existing.path() + "; ignoring " + candidate.directory(), null);
                adapterLoader.release(loadedAdapter);
                return;
            }

            LoadedProviderEntry entry = new LoadedProviderEntry(adapter, manifest, candidate.directory(),
                    loadedAdapter.contract(), ManifestHasher.hash(manifest));
            loaded.put(key, entry);
            log.debug("Registered provider {} ({}) from {}", name, entry.contract(), entry.path());
        }

        private void warn(ProviderLoadWarning.Code code, String message) {
            ProviderLoadWarning warning = new ProviderLoadWarning(label, code, message);
            warnings.add(warning);
            log.warn("Provider {} [{}]: {}", label, code, message);
        }

        private void error(ProviderLoadError.Code code, String message, Throwable cause) {
            errors.add(new ProviderLoadError(label, code, message, cause));
            if (cause != null) {
                log.error("Provider {} [{}]: {}", label, code, message, cause);
            } else {
                log.error("Provider {} [{}]: {}", label, code, message);
            }
        }
    }

    @Override
    public String toString() {
        return "ProviderRegistry{baseDir=" + baseDir + ", state=" + state + ", providers="
                + entries.values().stream().map(LoadedProviderEntry::name).collect(Collectors.joining(",")) + "}";
    }
}
