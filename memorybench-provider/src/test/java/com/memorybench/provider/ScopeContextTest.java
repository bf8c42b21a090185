package com.memorybench.provider;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeContextTest {

    @Test
    void constructor_rejectsBlankRequiredFieldsListingEach() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ScopeContext(" ", null, null, null));

        assertTrue(e.getMessage().contains("user_id"));
        assertTrue(e.getMessage().contains("run_id"));
    }

    @Test
    void fromMap_readsSnakeCaseKeys() {
        ScopeContext scope = ScopeContext.fromMap(Map.of("user_id", "u", "run_id", "r", "namespace", "ns"));

        assertEquals("u", scope.userId());
        assertEquals("r", scope.runId());
        assertNull(scope.sessionId());
        assertEquals("ns", scope.namespace());
    }

    @Test
    void fromMap_reportsWrongTypes() {
        Map<String, Object> values = new HashMap<>();
        values.put("user_id", "u");
        values.put("run_id", 7);
        values.put("session_id", false);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ScopeContext.fromMap(values));

        assertTrue(e.getMessage().contains("run_id"));
        assertTrue(e.getMessage().contains("session_id"));
        assertFalse(e.getMessage().contains("user_id"));
    }

    @Test
    void toMap_omitsAbsentOptionalFields() {
        assertEquals(Map.of("user_id", "u", "run_id", "r"), ScopeContext.of("u", "r").toMap());
    }
}
