/**
 * Provider manifest model, schema validation and content hashing.
 * <ul>
 *   <li>{@link com.memorybench.manifest.ProviderManifest} – typed view of {@code manifest.json}</li>
 *   <li>{@link com.memorybench.manifest.ManifestValidator} – schema checks collecting every {@link com.memorybench.manifest.FieldError}</li>
 *   <li>{@link com.memorybench.manifest.ManifestLoader} – read + parse + validate one file</li>
 *   <li>{@link com.memorybench.manifest.ManifestHasher} – SHA-256 over canonical JSON</li>
 * </ul>
 */
package com.memorybench.manifest;
