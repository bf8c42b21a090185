package com.memorybench.manifest;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates parsed manifest JSON against the version 1 schema and binds it to {@link ProviderManifest}.
 * <p>
 * An unsupported {@code manifest_version} string is reported on its own, listing the supported
 * versions, before any structural check runs. Otherwise every violated constraint becomes one
 * {@link FieldError}; checks do not stop at the first failure. When a required object is missing or
 * has the wrong type only that object is reported, not each of its children. Unknown keys are always
 * accepted.
 * <p>
 * Pure function of its input; safe to call from any thread.
 */
public final class ManifestValidator {

    private static final String MANIFEST_VERSION = "manifest_version";

    private ManifestValidator() {
    }

    /**
     * Validates {@code json} (the parsed content of the file at {@code path}).
     *
     * @param json parsed JSON; null is treated as a missing document
     * @param path file path used in the error; not read
     */
    public static ManifestValidationResult validate(JsonNode json, String path) {
        if (json != null && json.isObject()) {
            JsonNode version = json.get(MANIFEST_VERSION);
            if (version != null && version.isTextual() && !SupportedManifestVersions.isSupported(version.asText())) {
                return ManifestValidationResult.failure(new ManifestValidationError(path, List.of(
                        new FieldError(MANIFEST_VERSION, FieldError.RULE_UNSUPPORTED_VERSION,
                                SupportedManifestVersions.describe(), version.asText()))));
            }
        }

        List<FieldError> errors = new ArrayList<>();
        if (json == null || !json.isObject()) {
            errors.add(typeError("", "object", json));
            return ManifestValidationResult.failure(new ManifestValidationError(path, errors));
        }

        checkManifestVersion(json, errors);

        JsonNode provider = requireObject(json, "", "provider", errors);
        if (provider != null) {
            requireNonEmptyString(provider, "provider", "name", errors);
            requireEnum(provider, "provider", "type", ProviderType.wireValues(), errors);
            requireNonEmptyString(provider, "provider", "version", errors);
        }

        JsonNode capabilities = requireObject(json, "", "capabilities", errors);
        if (capabilities != null) {
            checkCapabilities(capabilities, errors);
        }

        JsonNode semantic = requireObject(json, "", "semantic_properties", errors);
        if (semantic != null) {
            requireEnum(semantic, "semantic_properties", "update_strategy", UpdateStrategy.wireValues(), errors);
            requireEnum(semantic, "semantic_properties", "delete_strategy", DeleteStrategy.wireValues(), errors);
        }

        JsonNode conformance = requireObject(json, "", "conformance_tests", errors);
        if (conformance != null) {
            JsonNode expected = requireObject(conformance, "conformance_tests", "expected_behavior", errors);
            if (expected != null) {
                requireNonNegativeInt(expected, "conformance_tests.expected_behavior", "convergence_wait_ms", errors);
            }
        }

        if (!errors.isEmpty()) {
            return ManifestValidationResult.failure(new ManifestValidationError(path, errors));
        }
        try {
            return ManifestValidationResult.success(ManifestJson.fromTree(json));
        } catch (UncheckedIOException e) {
            return ManifestValidationResult.failure(new ManifestValidationError(path, List.of(
                    new FieldError("", FieldError.RULE_INVALID_TYPE, "Bindable provider manifest",
                            e.getCause() != null ? e.getCause().getMessage() : e.getMessage()))));
        }
    }

    private static void checkManifestVersion(JsonNode json, List<FieldError> errors) {
        JsonNode version = json.get(MANIFEST_VERSION);
        if (version == null) {
            errors.add(typeError(MANIFEST_VERSION, "string", null));
        } else if (!version.isTextual()) {
            // supported-but-wrong-type, e.g. the number 1 instead of the string "1"
            errors.add(new FieldError(MANIFEST_VERSION, FieldError.RULE_INVALID_LITERAL,
                    "Expected " + quoted(SupportedManifestVersions.VERSIONS.get(SupportedManifestVersions.VERSIONS.size() - 1)),
                    "Received " + version));
        }
    }

    private static void checkCapabilities(JsonNode capabilities, List<FieldError> errors) {
        String base = "capabilities";

        JsonNode core = requireObject(capabilities, base, "core_operations", errors);
        if (core != null) {
            String p = base + ".core_operations";
            requireBoolean(core, p, "add_memory", errors);
            requireBoolean(core, p, "retrieve_memory", errors);
            requireBoolean(core, p, "delete_memory", errors);
        }

        JsonNode optional = requireObject(capabilities, base, "optional_operations", errors);
        if (optional != null) {
            String p = base + ".optional_operations";
            optionalBoolean(optional, p, "update_memory", errors);
            optionalBoolean(optional, p, "list_memories", errors);
            optionalBoolean(optional, p, "reset_scope", errors);
            optionalBoolean(optional, p, "get_capabilities", errors);
        }

        JsonNode system = requireObject(capabilities, base, "system_flags", errors);
        if (system != null) {
            String p = base + ".system_flags";
            requireBoolean(system, p, "async_indexing", errors);
            if (system.has("processing_latency")) requireNonNegativeInt(system, p, "processing_latency", errors);
            if (system.has("convergence_wait_ms")) requireNonNegativeInt(system, p, "convergence_wait_ms", errors);
        }

        JsonNode intelligence = requireObject(capabilities, base, "intelligence_flags", errors);
        if (intelligence != null) {
            String p = base + ".intelligence_flags";
            requireBoolean(intelligence, p, "auto_extraction", errors);
            requireBoolean(intelligence, p, "graph_support", errors);
            JsonNode graphType = intelligence.get("graph_type");
            if (graphType != null && !graphType.isTextual()) {
                errors.add(typeError(join(p, "graph_type"), "string", graphType));
            }
        }
    }

    /** Returns the child object, or records an error and returns null. */
    private static JsonNode requireObject(JsonNode parent, String prefix, String key, List<FieldError> errors) {
        JsonNode node = parent.get(key);
        if (node == null || !node.isObject()) {
            errors.add(typeError(join(prefix, key), "object", node));
            return null;
        }
        return node;
    }

    private static void requireBoolean(JsonNode parent, String prefix, String key, List<FieldError> errors) {
        JsonNode node = parent.get(key);
        if (node == null || !node.isBoolean()) {
            errors.add(typeError(join(prefix, key), "boolean", node));
        }
    }

    private static void optionalBoolean(JsonNode parent, String prefix, String key, List<FieldError> errors) {
        JsonNode node = parent.get(key);
        if (node != null && !node.isBoolean()) {
            errors.add(typeError(join(prefix, key), "boolean", node));
        }
    }

    private static void requireNonEmptyString(JsonNode parent, String prefix, String key, List<FieldError> errors) {
        JsonNode node = parent.get(key);
        if (node == null || !node.isTextual()) {
            errors.add(typeError(join(prefix, key), "string", node));
        } else if (node.asText().isEmpty()) {
            errors.add(new FieldError(join(prefix, key), FieldError.RULE_TOO_SMALL, "Minimum length: 1", "Received \"\""));
        }
    }

    private static void requireEnum(JsonNode parent, String prefix, String key, List<String> allowed,
                                    List<FieldError> errors) {
        JsonNode node = parent.get(key);
        if (node == null || !node.isTextual()) {
            errors.add(typeError(join(prefix, key), "string", node));
        } else if (!allowed.contains(node.asText())) {
            errors.add(new FieldError(join(prefix, key), FieldError.RULE_INVALID_ENUM_VALUE,
                    "Expected one of: " + String.join(", ", allowed), "Received " + quoted(node.asText())));
        }
    }

    private static void requireNonNegativeInt(JsonNode parent, String prefix, String key, List<FieldError> errors) {
        JsonNode node = parent.get(key);
        String field = join(prefix, key);
        if (node == null || !node.isNumber()) {
            errors.add(typeError(field, "number", node));
            return;
        }
        if (!isWholeNumber(node)) {
            errors.add(new FieldError(field, FieldError.RULE_INVALID_TYPE, "Expected integer", "Received float"));
            return;
        }
        if (node.asLong() < 0) {
            errors.add(new FieldError(field, FieldError.RULE_TOO_SMALL, "Minimum value: 0", "Received " + node.asText()));
        } else if (node.asLong() > Integer.MAX_VALUE) {
            errors.add(new FieldError(field, FieldError.RULE_INVALID_TYPE, "Expected integer <= " + Integer.MAX_VALUE,
                    "Received " + node.asText()));
        }
    }

    private static boolean isWholeNumber(JsonNode node) {
        if (node.isIntegralNumber()) return true;
        double d = node.asDouble();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    private static FieldError typeError(String field, String expectedType, JsonNode actual) {
        return new FieldError(field, FieldError.RULE_INVALID_TYPE, "Expected " + expectedType, "Received " + describeType(actual));
    }

    /** JSON type name of {@code node}; a missing node is "undefined". */
    static String describeType(JsonNode node) {
        if (node == null || node.isMissingNode()) return "undefined";
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isBoolean()) return "boolean";
        if (node.isNumber()) return "number";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }

    private static String join(String prefix, String key) {
        return prefix == null || prefix.isEmpty() ? key : prefix + "." + key;
    }

    private static String quoted(String s) {
        return "\"" + s + "\"";
    }
}
