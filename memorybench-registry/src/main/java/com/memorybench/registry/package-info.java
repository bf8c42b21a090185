/**
 * Discovery, loading and registration of memory providers.
 * <ul>
 *   <li>{@link com.memorybench.registry.ProviderRegistry} – initialize once, then look up by name</li>
 *   <li>{@link com.memorybench.registry.ProviderDiscovery} – finds {@code manifest.json} and {@code index.*} under {@code providers/}</li>
 *   <li>{@link com.memorybench.registry.AdapterLoader} – {@code index.properties} / {@code index.jar} module formats</li>
 *   <li>{@link com.memorybench.registry.RestrictedAdapterClassLoader} – package allow-list for jar-based adapters</li>
 *   <li>{@link com.memorybench.registry.CapabilityConformanceChecker} – declared vs. implemented optional operations</li>
 * </ul>
 * Loading is partial: each provider that fails adds a {@link com.memorybench.registry.ProviderLoadError}
 * or {@link com.memorybench.registry.ProviderLoadWarning} to the
 * {@link com.memorybench.registry.ProviderRegistryResult} and the rest still load.
 */
package com.memorybench.registry;
