package com.memorybench.provider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegacyProviderWrapperTest {

    private static final ScopeContext SCOPE = new ScopeContext("user-1", "run-1", "session-1", null);

    /** Records what the wrapper forwards. */
    static final class RecordingLegacyProvider implements LegacyProvider {
        final List<PreparedData> added = new ArrayList<>();
        final List<String> queries = new ArrayList<>();

        @Override
        public String getName() {
            return "internal-legacy-name";
        }

        @Override
        public void addContext(PreparedData data) {
            added.add(data);
        }

        @Override
        public List<LegacySearchResult> searchQuery(String query) {
            queries.add(query);
            return List.of(
                    new LegacySearchResult("a", "first " + query, 0.9),
                    new LegacySearchResult("b", "second " + query, 0.5),
                    new LegacySearchResult("c", "third " + query, 0.1));
        }

        @Override
        public List<PreparedData> prepareProvider(String benchmarkType, List<Map<String, Object>> data) {
            return List.of();
        }
    }

    @Test
    void getName_returnsConstructorValue() {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "manifest-name");

        assertEquals("manifest-name", wrapper.getName());
    }

    @Test
    void addMemory_packagesScopeAndGeneratedId() throws Exception {
        RecordingLegacyProvider legacy = new RecordingLegacyProvider();
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(legacy, "legacy");

        MemoryRecord record = wrapper.addMemory(SCOPE, "remember this", Map.of("source", "test"));

        assertEquals(1, legacy.added.size());
        PreparedData sent = legacy.added.get(0);
        assertEquals("remember this", sent.context());
        assertEquals("test", sent.metadata().get("source"));
        assertEquals(record.id(), sent.metadata().get("_generated_id"));
        @SuppressWarnings("unchecked")
        Map<String, Object> scope = (Map<String, Object>) sent.metadata().get("_scope");
        assertEquals("user-1", scope.get("user_id"));
        assertEquals("run-1", scope.get("run_id"));
        assertEquals("session-1", scope.get("session_id"));

        assertEquals("remember this", record.context());
        assertEquals(Map.of("source", "test"), record.metadata());
        assertTrue(record.timestamp() > 0);
    }

    @Test
    void addMemory_generatesFreshIdEachCall() throws Exception {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "legacy");

        MemoryRecord first = wrapper.addMemory(SCOPE, "one", null);
        MemoryRecord second = wrapper.addMemory(SCOPE, "two", null);

        assertNotEquals(first.id(), second.id());
        assertTrue(first.metadata().isEmpty());
    }

    @Test
    void retrieveMemory_mapsHitsAndForwardsQuery() throws Exception {
        RecordingLegacyProvider legacy = new RecordingLegacyProvider();
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(legacy, "legacy");

        List<RetrievalItem> items = wrapper.retrieveMemory(SCOPE, "q", null);

        assertEquals(List.of("q"), legacy.queries);
        assertEquals(3, items.size());
        assertEquals("a", items.get(0).record().id());
        assertEquals("first q", items.get(0).record().context());
        assertEquals(0.9, items.get(0).score());
        assertTrue(items.get(0).record().metadata().isEmpty());
    }

    @Test
    void retrieveMemory_truncatesToLimit() throws Exception {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "legacy");

        assertEquals(2, wrapper.retrieveMemory(SCOPE, "q", 2).size());
        assertEquals(3, wrapper.retrieveMemory(SCOPE, "q", 10).size());
    }

    @Test
    void retrieveMemory_zeroLimitYieldsEmpty() throws Exception {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "legacy");

        assertTrue(wrapper.retrieveMemory(SCOPE, "q", 0).isEmpty());
    }

    @Test
    void deleteMemory_alwaysUnsupported() {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "legacy-x");

        UnsupportedProviderOperationException e = assertThrows(UnsupportedProviderOperationException.class,
                () -> wrapper.deleteMemory(SCOPE, "a"));

        assertEquals("legacy-x", e.getProviderName());
        assertEquals("delete_memory", e.getOperation());
        assertEquals("Provider 'legacy-x' does not support operation: delete_memory", e.getMessage());
    }

    @Test
    void wrapper_exposesNoOptionalOperation() {
        LegacyProviderWrapper wrapper = new LegacyProviderWrapper(new RecordingLegacyProvider(), "legacy");

        assertTrue(ProviderOperations.implementedOptionalOperations(wrapper).isEmpty());
    }
}
