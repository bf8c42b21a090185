package com.memorybench.registry;

/** Lifecycle of a {@link ProviderRegistry}. */
public enum RegistryState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
