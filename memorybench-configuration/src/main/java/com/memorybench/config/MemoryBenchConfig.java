package com.memorybench.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for provider discovery and loading.
 * <p>
 * MEMORYBENCH_BASE_DIR: directory that contains {@code providers/} (default {@code .}).
 * MEMORYBENCH_CONVERGENCE_WARN_MS: manifests declaring a larger
 * {@code conformance_tests.expected_behavior.convergence_wait_ms} get a warning (default 10000).
 * MEMORYBENCH_ADAPTER_LOAD_TIMEOUT_SECONDS: per-provider deadline for instantiating an adapter, 0 for
 * none (default 0).
 * MEMORYBENCH_WARN_UNDECLARED_CAPABILITIES: warn about optional operations an adapter implements but
 * its manifest does not declare (default true).
 */
public final class MemoryBenchConfig {

    static final String ENV_BASE_DIR = "MEMORYBENCH_BASE_DIR";
    static final String ENV_CONVERGENCE_WARN_MS = "MEMORYBENCH_CONVERGENCE_WARN_MS";
    static final String ENV_ADAPTER_LOAD_TIMEOUT_SECONDS = "MEMORYBENCH_ADAPTER_LOAD_TIMEOUT_SECONDS";
    static final String ENV_WARN_UNDECLARED_CAPABILITIES = "MEMORYBENCH_WARN_UNDECLARED_CAPABILITIES";

    public static final String DEFAULT_BASE_DIR = ".";
    public static final int DEFAULT_CONVERGENCE_WARN_MS = 10_000;
    public static final int DEFAULT_ADAPTER_LOAD_TIMEOUT_SECONDS = 0;
    public static final boolean DEFAULT_WARN_UNDECLARED_CAPABILITIES = true;

    private final Path baseDir;
    private final int convergenceWarnMs;
    private final int adapterLoadTimeoutSeconds;
    private final boolean warnUndeclaredCapabilities;

    private MemoryBenchConfig(Builder b) {
        this.baseDir = b.baseDir;
        this.convergenceWarnMs = b.convergenceWarnMs;
        this.adapterLoadTimeoutSeconds = b.adapterLoadTimeoutSeconds;
        this.warnUndeclaredCapabilities = b.warnUndeclaredCapabilities;
    }

    /** Directory containing {@code providers/}. */
    public Path getBaseDir() {
        return baseDir;
    }

    /** {@code baseDir/providers}. */
    public Path getProvidersDir() {
        return baseDir.resolve("providers");
    }

    /** Convergence waits above this many milliseconds produce a {@code HIGH_CONVERGENCE_WAIT} warning. */
    public int getConvergenceWarnMs() {
        return convergenceWarnMs;
    }

    /** Seconds allowed for instantiating one adapter; 0 means no deadline. */
    public int getAdapterLoadTimeoutSeconds() {
        return adapterLoadTimeoutSeconds;
    }

    public boolean isWarnUndeclaredCapabilities() {
        return warnUndeclaredCapabilities;
    }

    /** Defaults only; ignores the environment. */
    public static MemoryBenchConfig defaults() {
        return builder().build();
    }

    public static MemoryBenchConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads the same keys as {@link #fromEnvironment()} from a map, e.g. in tests. */
    public static MemoryBenchConfig fromMap(Map<String, String> values) {
        return fromEnvironment(values::get);
    }

    static MemoryBenchConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .baseDir(Paths.get(getEnv(env, ENV_BASE_DIR, DEFAULT_BASE_DIR)))
                .convergenceWarnMs(parseInt(env.apply(ENV_CONVERGENCE_WARN_MS), DEFAULT_CONVERGENCE_WARN_MS))
                .adapterLoadTimeoutSeconds(parseInt(env.apply(ENV_ADAPTER_LOAD_TIMEOUT_SECONDS), DEFAULT_ADAPTER_LOAD_TIMEOUT_SECONDS))
                .warnUndeclaredCapabilities(parseBoolean(env.apply(ENV_WARN_UNDECLARED_CAPABILITIES), DEFAULT_WARN_UNDECLARED_CAPABILITIES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this configuration with another base directory. */
    public MemoryBenchConfig withBaseDir(Path baseDir) {
        return builder()
                .baseDir(baseDir)
                .convergenceWarnMs(convergenceWarnMs)
                .adapterLoadTimeoutSeconds(adapterLoadTimeoutSeconds)
                .warnUndeclaredCapabilities(warnUndeclaredCapabilities)
                .build();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "MemoryBenchConfig{baseDir=" + baseDir + ", convergenceWarnMs=" + convergenceWarnMs
                + ", adapterLoadTimeoutSeconds=" + adapterLoadTimeoutSeconds
                + ", warnUndeclaredCapabilities=" + warnUndeclaredCapabilities + "}";
    }

    public static final class Builder {
        private Path baseDir = Paths.get(DEFAULT_BASE_DIR);
        private int convergenceWarnMs = DEFAULT_CONVERGENCE_WARN_MS;
        private int adapterLoadTimeoutSeconds = DEFAULT_ADAPTER_LOAD_TIMEOUT_SECONDS;
        private boolean warnUndeclaredCapabilities = DEFAULT_WARN_UNDECLARED_CAPABILITIES;

        public Builder baseDir(Path baseDir) {
            this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
            return this;
        }

        public Builder convergenceWarnMs(int convergenceWarnMs) {
            if (convergenceWarnMs < 0) {
                throw new IllegalArgumentException("convergenceWarnMs must be >= 0: " + convergenceWarnMs);
            }
            this.convergenceWarnMs = convergenceWarnMs;
            return this;
        }

        public Builder adapterLoadTimeoutSeconds(int adapterLoadTimeoutSeconds) {
            if (adapterLoadTimeoutSeconds < 0) {
                throw new IllegalArgumentException("adapterLoadTimeoutSeconds must be >= 0: " + adapterLoadTimeoutSeconds);
            }
            this.adapterLoadTimeoutSeconds = adapterLoadTimeoutSeconds;
            return this;
        }

        public Builder warnUndeclaredCapabilities(boolean warnUndeclaredCapabilities) {
            this.warnUndeclaredCapabilities = warnUndeclaredCapabilities;
            return this;
        }

        public MemoryBenchConfig build() {
            return new MemoryBenchConfig(this);
        }
    }
}
