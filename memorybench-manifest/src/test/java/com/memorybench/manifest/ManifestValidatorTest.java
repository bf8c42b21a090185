package com.memorybench.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PATH = "providers/test/manifest.json";

    static JsonNode fixture(String name) throws Exception {
        URL url = ManifestValidatorTest.class.getResource("/manifests/" + name);
        assertNotNull(url, "missing fixture " + name);
        return MAPPER.readTree(Path.of(url.toURI()).toFile());
    }

    @Test
    void validate_acceptsFullManifest() throws Exception {
        ManifestValidationResult result = ManifestValidator.validate(fixture("valid-full.json"), PATH);

        assertTrue(result.isValid());
        assertNull(result.getError());
        ProviderManifest manifest = result.getManifest();
        assertEquals("valid-full", manifest.providerName());
        assertEquals(ProviderType.HYBRID, manifest.getProvider().getType());
        assertEquals(UpdateStrategy.EVENTUAL, manifest.updateStrategy());
        assertEquals(DeleteStrategy.SOFT_DELETE, manifest.deleteStrategy());
        assertEquals(500, manifest.convergenceWaitMs());
        assertEquals(Boolean.TRUE, manifest.getCapabilities().getOptionalOperations().getResetScope());
    }

    @Test
    void validate_acceptsMinimalManifestWithEmptyOptionalOperations() throws Exception {
        ManifestValidationResult result = ManifestValidator.validate(fixture("valid-minimal.json"), PATH);

        assertTrue(result.isValid());
        assertTrue(result.getManifest().getCapabilities().getOptionalOperations().declared().isEmpty());
        assertNull(result.getManifest().getCapabilities().getIntelligenceFlags().getGraphType());
    }

    @Test
    void validate_reportsMissingProviderVersion() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        ((ObjectNode) json.get("provider")).remove("version");

        ManifestValidationResult result = ManifestValidator.validate(json, PATH);

        assertFalse(result.isValid());
        List<FieldError> errors = result.getError().getErrors();
        assertEquals(1, errors.size());
        assertEquals("provider.version", errors.get(0).field());
        assertEquals(FieldError.RULE_INVALID_TYPE, errors.get(0).rule());
        assertEquals("Expected string", errors.get(0).expected());
        assertEquals("Received undefined", errors.get(0).received());
        assertEquals(PATH, result.getError().getPath());
    }

    @Test
    void validate_listsAllowedValuesForInvalidEnum() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        ((ObjectNode) json.get("provider")).put("type", "cloud");

        FieldError error = ManifestValidator.validate(json, PATH).getError().getErrors().get(0);

        assertEquals("provider.type", error.field());
        assertEquals(FieldError.RULE_INVALID_ENUM_VALUE, error.rule());
        assertEquals("Expected one of: intelligent_memory, hybrid, framework", error.expected());
        assertEquals("Received \"cloud\"", error.received());
    }

    @Test
    void validate_unsupportedVersionIsTheOnlyError() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        json.put("manifest_version", "2");
        json.remove("provider");

        ManifestValidationResult result = ManifestValidator.validate(json, PATH);

        assertEquals(1, result.getError().getErrors().size());
        FieldError error = result.getError().getErrors().get(0);
        assertEquals("manifest_version", error.field());
        assertEquals(FieldError.RULE_UNSUPPORTED_VERSION, error.rule());
        assertEquals("Supported versions: 1", error.expected());
        assertEquals("2", error.received());
    }

    @Test
    void validate_numericVersionIsInvalidLiteral() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        json.put("manifest_version", 1);

        FieldError error = ManifestValidator.validate(json, PATH).getError().getErrors().get(0);

        assertEquals(FieldError.RULE_INVALID_LITERAL, error.rule());
        assertEquals("Expected \"1\"", error.expected());
    }

    @Test
    void validate_collectsEveryViolation() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        ((ObjectNode) json.get("provider")).put("name", "");
        ((ObjectNode) json.get("semantic_properties")).put("delete_strategy", "shred");
        ((ObjectNode) json.get("conformance_tests").get("expected_behavior")).put("convergence_wait_ms", -5);
        ((ObjectNode) json.get("capabilities").get("system_flags")).put("processing_latency", 1.5);

        ManifestValidationError error = ManifestValidator.validate(json, PATH).getError();

        assertEquals(4, error.getErrors().size());
        assertTrue(error.hasErrorFor("provider.name"));
        assertTrue(error.hasErrorFor("semantic_properties.delete_strategy"));
        assertTrue(error.hasErrorFor("conformance_tests.expected_behavior.convergence_wait_ms"));
        assertTrue(error.hasErrorFor("capabilities.system_flags.processing_latency"));
        assertTrue(error.format().contains("  - provider.name: Minimum length: 1. Received \"\"."));
        assertTrue(error.format().contains("Minimum value: 0. Received -5."));
        assertTrue(error.format().contains("Expected integer. Received float."));
    }

    @Test
    void validate_missingParentReportsOnlyTheParent() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        json.remove("capabilities");

        ManifestValidationError error = ManifestValidator.validate(json, PATH).getError();

        assertEquals(1, error.getErrors().size());
        assertEquals("capabilities", error.getErrors().get(0).field());
        assertEquals("Expected object", error.getErrors().get(0).expected());
    }

    @Test
    void validate_wholeFloatCountsAsInteger() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-minimal.json");
        ((ObjectNode) json.get("conformance_tests").get("expected_behavior")).put("convergence_wait_ms", 250.0);

        ManifestValidationResult result = ManifestValidator.validate(json, PATH);

        assertTrue(result.isValid());
        assertEquals(250, result.getManifest().convergenceWaitMs());
    }

    @Test
    void validate_rejectsNonObjectRoot() throws Exception {
        ManifestValidationResult result = ManifestValidator.validate(MAPPER.readTree("[1, 2]"), PATH);

        assertFalse(result.isValid());
        assertTrue(result.getError().format().contains("(root): Expected object. Received array."));
    }

    @Test
    void validate_preservesUnknownFieldsThroughTheModel() throws Exception {
        ObjectNode json = (ObjectNode) fixture("valid-full.json");
        json.putObject("x_vendor").put("tier", "enterprise");

        ProviderManifest manifest = ManifestValidator.validate(json, PATH).getManifest();
        JsonNode written = ManifestJson.toTree(manifest);

        assertEquals("https://example.org/valid-full", manifest.getProvider().getExtension("homepage"));
        assertEquals("enterprise", written.path("x_vendor").path("tier").asText());
        assertEquals("text-embedding-3-small",
                written.path("capabilities").path("intelligence_flags").path("embedding_model").asText());
        assertEquals(json, written);
    }
}
