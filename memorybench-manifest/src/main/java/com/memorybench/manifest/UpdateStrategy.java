package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Update semantics ({@code semantic_properties.update_strategy}). */
public enum UpdateStrategy {

    IMMEDIATE("immediate"),
    EVENTUAL("eventual"),
    VERSIONED("versioned"),
    IMMUTABLE("immutable");

    private final String value;

    UpdateStrategy(String value) {
        this.value = value;
    }

    /** Wire value as written in manifest.json. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Wire values in declaration order, for error messages. */
    public static List<String> wireValues() {
        return Arrays.stream(values()).map(UpdateStrategy::value).collect(Collectors.toList());
    }

    @JsonCreator
    public static UpdateStrategy fromValue(String value) {
        for (UpdateStrategy v : values()) {
            if (v.value.equals(value)) return v;
        }
        throw new IllegalArgumentException("Unknown UpdateStrategy: " + value + " (expected one of " + wireValues() + ")");
    }
}
