package com.memorybench.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Content hash of a manifest: SHA-256 over canonical JSON (object keys sorted at every depth, array
 * order kept, no whitespace). Two manifests that differ only in key order hash the same.
 */
public final class ManifestHasher {

    private ManifestHasher() {
    }

    /** Lowercase hex SHA-256 of the canonical form of {@code manifest}, unknown fields included. */
    public static String hash(ProviderManifest manifest) {
        return sha256Hex(canonicalJson(ManifestJson.toTree(manifest)));
    }

    /** Lowercase hex SHA-256 of the canonical form of an arbitrary JSON tree. */
    public static String hash(JsonNode json) {
        return sha256Hex(canonicalJson(json));
    }

    /** Compact JSON with object keys sorted recursively. Whole floating point numbers are written as integers. */
    public static String canonicalJson(JsonNode json) {
        try {
            return ManifestJson.MAPPER.writeValueAsString(canonicalize(json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (node == null || node.isMissingNode()) {
            return f.nullNode();
        }
        if (node.isObject()) {
            List<String> keys = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                keys.add(it.next());
            }
            keys.sort(null);
            ObjectNode sorted = f.objectNode();
            for (String key : keys) {
                sorted.set(key, canonicalize(node.get(key)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode out = f.arrayNode();
            for (JsonNode element : node) {
                out.add(canonicalize(element));
            }
            return out;
        }
        if (node.isFloatingPointNumber()) {
            double d = node.asDouble();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return f.numberNode((long) d);
            }
        }
        return node;
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            StringBuilder sb = new StringBuilder();
            for (byte b : md.digest(text.getBytes(StandardCharsets.UTF_8))) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
