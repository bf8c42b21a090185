package com.memorybench.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Input unit of the legacy contract: text plus free-form metadata. */
public record PreparedData(String context, Map<String, Object> metadata) {

    public PreparedData {
        context = context != null ? context : "";
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
