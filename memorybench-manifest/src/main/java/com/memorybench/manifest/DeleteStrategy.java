package com.memorybench.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Delete semantics ({@code semantic_properties.delete_strategy}). */
public enum DeleteStrategy {

    IMMEDIATE("immediate"),
    EVENTUAL("eventual"),
    SOFT_DELETE("soft_delete");

    private final String value;

    DeleteStrategy(String value) {
        this.value = value;
    }

    /** Wire value as written in manifest.json. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Wire values in declaration order, for error messages. */
    public static List<String> wireValues() {
        return Arrays.stream(values()).map(DeleteStrategy::value).collect(Collectors.toList());
    }

    @JsonCreator
    public static DeleteStrategy fromValue(String value) {
        for (DeleteStrategy v : values()) {
            if (v.value.equals(value)) return v;
        }
        throw new IllegalArgumentException("Unknown DeleteStrategy: " + value + " (expected one of " + wireValues() + ")");
    }
}
