package com.memorybench.manifest;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads {@code manifest.json} files. I/O and syntax problems are reported the same way as schema
 * problems: a failed {@link ManifestValidationResult} with a single {@code _file} error.
 */
public final class ManifestLoader {

    static final String FILE_FIELD = "_file";

    private ManifestLoader() {
    }

    /**
     * Reads, parses and validates the manifest at {@code path}.
     */
    public static ManifestValidationResult loadAndValidate(Path path) {
        String display = path.toString();
        JsonNode json;
        try {
            json = readTree(path);
        } catch (JsonProcessingException e) {
            return parseFailure(display, describe(display, e));
        } catch (IOException e) {
            return parseFailure(display, "Cannot read " + display + ": " + e.getMessage());
        }
        if (json == null || json.isMissingNode()) {
            return parseFailure(display, "Empty file " + display);
        }
        return ManifestValidator.validate(json, display);
    }

    private static JsonNode readTree(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return ManifestJson.MAPPER.readTree(bytes);
    }

    private static ManifestValidationResult parseFailure(String path, String received) {
        return ManifestValidationResult.failure(new ManifestValidationError(path, List.of(
                new FieldError(FILE_FIELD, FieldError.RULE_PARSE_ERROR, "Valid JSON file", received))));
    }

    private static String describe(String path, JsonProcessingException e) {
        JsonLocation loc = e.getLocation();
        StringBuilder sb = new StringBuilder("Invalid JSON syntax in ").append(path);
        if (loc != null && loc.getLineNr() > 0) {
            sb.append(" at line ").append(loc.getLineNr()).append(", column ").append(loc.getColumnNr());
        }
        return sb.append(": ").append(e.getOriginalMessage()).toString();
    }
}
