package com.memorybench.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** All field-level problems found in one manifest file. */
public final class ManifestValidationError {

    private final String path;
    private final List<FieldError> errors;

    public ManifestValidationError(String path, List<FieldError> errors) {
        this.path = path != null ? path : "";
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    /** Path of the manifest file as given to the validator. */
    public String getPath() {
        return path;
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    /** True if some error targets exactly {@code field}. */
    public boolean hasErrorFor(String field) {
        for (FieldError e : errors) {
            if (Objects.equals(e.field(), field)) return true;
        }
        return false;
    }

    /**
     * Human-readable, multi-line rendering:
     * <pre>
     * Manifest validation failed: providers/foo/manifest.json
     *   - provider.type: Expected one of: intelligent_memory, hybrid, framework. Received "cloud".
     * </pre>
     */
    public String format() {
        StringBuilder sb = new StringBuilder("Manifest validation failed: ").append(path);
        for (FieldError e : errors) {
            sb.append('\n').append("  - ")
                    .append(e.field().isEmpty() ? "(root)" : e.field()).append(": ")
                    .append(e.expected()).append(". ")
                    .append(e.received()).append('.');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
