package com.memorybench.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution context passed to every adapter operation, used to isolate test runs and tenants.
 *
 * @param userId    required, non-blank
 * @param runId     required, non-blank
 * @param sessionId optional
 * @param namespace optional
 */
public record ScopeContext(String userId, String runId, String sessionId, String namespace) {

    private static final String EXPECTED_SHAPE =
            "Expected { user_id: string, run_id: string, session_id?: string, namespace?: string }";

    public ScopeContext {
        List<String> issues = new ArrayList<>();
        if (userId == null || userId.isBlank()) {
            issues.add("missing or invalid user_id (expected non-blank string)");
        }
        if (runId == null || runId.isBlank()) {
            issues.add("missing or invalid run_id (expected non-blank string)");
        }
        if (!issues.isEmpty()) {
            throw new IllegalArgumentException(message(issues));
        }
    }

    public static ScopeContext of(String userId, String runId) {
        return new ScopeContext(userId, runId, null, null);
    }

    /**
     * Builds a scope from loosely typed input (e.g. a parsed config block with snake_case keys).
     * Every problem is listed in one exception message.
     *
     * @throws IllegalArgumentException if a required key is missing or any key has the wrong type
     */
    public static ScopeContext fromMap(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("Invalid ScopeContext: expected object, got null");
        }
        List<String> issues = new ArrayList<>();
        Object userId = values.get("user_id");
        Object runId = values.get("run_id");
        Object sessionId = values.get("session_id");
        Object namespace = values.get("namespace");
        if (!(userId instanceof String) || ((String) userId).isBlank()) {
            issues.add("missing or invalid user_id (expected non-blank string)");
        }
        if (!(runId instanceof String) || ((String) runId).isBlank()) {
            issues.add("missing or invalid run_id (expected non-blank string)");
        }
        if (sessionId != null && !(sessionId instanceof String)) {
            issues.add("invalid session_id (expected string or absent)");
        }
        if (namespace != null && !(namespace instanceof String)) {
            issues.add("invalid namespace (expected string or absent)");
        }
        if (!issues.isEmpty()) {
            throw new IllegalArgumentException(message(issues));
        }
        return new ScopeContext((String) userId, (String) runId, (String) sessionId, (String) namespace);
    }

    /** Snake_case view; absent optional fields are left out. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("user_id", userId);
        map.put("run_id", runId);
        if (sessionId != null) map.put("session_id", sessionId);
        if (namespace != null) map.put("namespace", namespace);
        return Collections.unmodifiableMap(map);
    }

    private static String message(List<String> issues) {
        return "Invalid ScopeContext: " + String.join(", ", issues) + ". " + EXPECTED_SHAPE;
    }
}
