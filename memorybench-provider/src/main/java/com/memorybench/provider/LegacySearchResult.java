package com.memorybench.provider;

/** Search hit shape of the legacy contract. */
public record LegacySearchResult(String id, String context, double score) {
}
