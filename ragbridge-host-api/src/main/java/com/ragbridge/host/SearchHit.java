package com.ragbridge.host;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One vector store search result. {@code score} is cosine similarity: higher is more similar, and
 * {@link VectorStore#search} returns hits in descending score order.
 */
public record SearchHit(String id, double score, Map<String, Object> metadata) {

    public SearchHit {
        Objects.requireNonNull(id, "id");
        metadata = metadata != null && !metadata.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /** Distance under the lower-is-closer convention used by retrieval results. */
    public double distance() {
        return 1.0 - score;
    }
}
