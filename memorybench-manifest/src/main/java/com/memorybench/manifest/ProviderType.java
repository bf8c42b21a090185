package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Provider architecture category ({@code provider.type}). */
public enum ProviderType {

    INTELLIGENT_MEMORY("intelligent_memory"),
    HYBRID("hybrid"),
    FRAMEWORK("framework");

    private final String value;

    ProviderType(String value) {
        this.value = value;
    }

    /** Wire value as written in manifest.json. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Wire values in declaration order, for error messages. */
    public static List<String> wireValues() {
        return Arrays.stream(values()).map(ProviderType::value).collect(Collectors.toList());
    }

    @JsonCreator
    public static ProviderType fromValue(String value) {
        for (ProviderType v : values()) {
            if (v.value.equals(value)) return v;
        }
        throw new IllegalArgumentException("Unknown ProviderType: " + value + " (expected one of " + wireValues() + ")");
    }
}
