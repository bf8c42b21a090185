package com.memorybench.registry;

import java.nio.file.Path;

/**
 * The {@code providers/} root does not exist or is not a directory. The only condition that aborts
 * registry initialization; problems with individual providers are reported in
 * {@link ProviderRegistryResult} instead.
 */
public class ProvidersDirectoryNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path providersDir;

    public ProvidersDirectoryNotFoundException(Path providersDir) {
        super("Providers directory not found: " + providersDir
                + ". Create it and add providers/<name>/manifest.json with an adapter module.");
        this.providersDir = providersDir;
    }

    public Path getProvidersDir() {
        return providersDir;
    }
}
