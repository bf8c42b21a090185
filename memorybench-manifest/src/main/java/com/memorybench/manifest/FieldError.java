package com.memorybench.manifest;

import java.util.Objects;

/**
 * One violated constraint in a manifest.
 *
 * @param field    dotted JSON path of the offending field (e.g. {@code provider.version}); empty for the root
 * @param rule     rule that failed (one of the {@code RULE_*} constants)
 * @param expected what the schema wants, human readable
 * @param received what was found, human readable
 */
public record FieldError(String field, String rule, String expected, String received) {

    public static final String RULE_INVALID_TYPE = "invalid_type";
    public static final String RULE_INVALID_LITERAL = "invalid_literal";
    public static final String RULE_INVALID_ENUM_VALUE = "invalid_enum_value";
    public static final String RULE_TOO_SMALL = "too_small";
    public static final String RULE_UNSUPPORTED_VERSION = "unsupported_version";
    public static final String RULE_PARSE_ERROR = "parse_error";

    public FieldError {
        field = field != null ? field : "";
        rule = Objects.requireNonNull(rule, "rule");
        expected = expected != null ? expected : "";
        received = received != null ? received : "";
    }
}
