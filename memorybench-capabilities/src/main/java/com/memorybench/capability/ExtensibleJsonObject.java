package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for manifest objects that keep JSON fields they do not model. Unknown fields are captured on
 * read and written back next to the typed fields on serialization, in their original order.
 */
public abstract class ExtensibleJsonObject {

    private final Map<String, Object> extensions = new LinkedHashMap<>();

    @JsonAnySetter
    protected void putExtension(String key, Object value) {
        extensions.put(key, value);
    }

    /** Fields not modelled by the concrete class; immutable view, never null. */
    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return Collections.unmodifiableMap(extensions);
    }

    /** Returns the unknown field with the given key, or null. */
    public Object getExtension(String key) {
        return extensions.get(key);
    }

    /** Copies extensions from another instance (used by builders and withX copies). */
    protected void copyExtensionsFrom(ExtensibleJsonObject other) {
        if (other != null) extensions.putAll(other.extensions);
    }

    protected void putAllExtensions(Map<String, Object> values) {
        if (values != null) extensions.putAll(values);
    }
}
