package com.memorybench.provider;

import java.util.List;
import java.util.Map;

/**
 * Older provider contract kept for backward compatibility. It has no scoping, no delete and different
 * method names from {@link ProviderAdapter}; the registry wraps such providers in
 * {@link LegacyProviderWrapper}.
 */
public interface LegacyProvider {

    String getName();

    void addContext(PreparedData data) throws Exception;

    List<LegacySearchResult> searchQuery(String query) throws Exception;

    /**
     * Converts raw benchmark items into {@link PreparedData}.
     *
     * @throws IllegalArgumentException if the provider does not handle {@code benchmarkType}
     */
    List<PreparedData> prepareProvider(String benchmarkType, List<Map<String, Object>> data);
}
