package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One retrieved item. {@code distance} follows the lower-is-closer convention; the bundled engines
 * report {@code 1 - cosineSimilarity}.
 */
public record RetrievalResultEntry(
        @JsonProperty("id") String id,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("distance") double distance
) {
    public RetrievalResultEntry {
        Objects.requireNonNull(id, "id");
        metadata = metadata != null ? Settings.copyOf(metadata) : Map.of();
    }

    /** Chunk text stored under the {@code text} metadata key, or empty. */
    public String text() {
        Object t = metadata.get("text");
        return t != null ? t.toString() : "";
    }
}
