/**
 * Shared capability vocabulary referenced by provider manifests and by the adapter contract.
 * <ul>
 *   <li>{@link com.memorybench.capability.ProviderCapabilities} – core/optional operations, system and intelligence flags</li>
 *   <li>{@link com.memorybench.capability.CoreOperation} – add_memory, retrieve_memory, delete_memory (every adapter)</li>
 *   <li>{@link com.memorybench.capability.OptionalOperation} – update_memory, list_memories, reset_scope, get_capabilities</li>
 * </ul>
 * Every object keeps unknown JSON fields in an extension map so that newer manifests round-trip
 * through older readers unchanged.
 */
package com.memorybench.capability;
