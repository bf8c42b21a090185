/**
 * Adapter contract used by benchmark runners.
 * <ul>
 *   <li>{@link com.memorybench.provider.ProviderAdapter} – required operations; optional ones are the
 *       {@code *Operation} sub-interfaces</li>
 *   <li>{@link com.memorybench.provider.LegacyProvider} – old contract, adapted by
 *       {@link com.memorybench.provider.LegacyProviderWrapper}</li>
 *   <li>{@link com.memorybench.provider.AdapterContract} – load-time contract detection</li>
 *   <li>{@link com.memorybench.provider.ProviderOperations} – optional-operation dispatch</li>
 * </ul>
 */
package com.memorybench.provider;
