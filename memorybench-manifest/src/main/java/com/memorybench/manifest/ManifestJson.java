package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization of {@link ProviderManifest}. Typed fields and preserved unknown fields are merged back
 * into one JSON object; null values are omitted.
 */
public final class ManifestJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ManifestJson() {
    }

    /** Shared mapper configured for manifests. Do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Maps already-validated JSON onto the typed model.
     *
     * @throws UncheckedIOException if the tree does not bind (callers validate first)
     */
    public static ProviderManifest fromTree(JsonNode json) {
        try {
            return MAPPER.treeToValue(json, ProviderManifest.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Converts the manifest back to a JSON tree, unknown fields included. */
    public static JsonNode toTree(ProviderManifest manifest) {
        return MAPPER.valueToTree(manifest);
    }

    /** Compact JSON string. */
    public static String toJson(ProviderManifest manifest) {
        try {
            return MAPPER.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
