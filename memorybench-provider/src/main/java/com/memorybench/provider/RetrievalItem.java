package com.memorybench.provider;

import java.util.Objects;

/** A retrieval hit: the matching record and its relevance score (higher is better). */
public record RetrievalItem(MemoryRecord record, double score) {

    public RetrievalItem {
        Objects.requireNonNull(record, "record");
    }
}
