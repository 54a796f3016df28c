package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Structured result of {@code RagEngine.retrieve}: entries ordered by decreasing relevance
 * (ascending distance) plus response-level metadata such as {@code took_ms} or {@code rerank_applied}.
 */
public record RetrievalResponse(
        @JsonProperty("results") List<RetrievalResultEntry> results,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String LEGACY_KEY = "legacy";

    public RetrievalResponse {
        results = results != null ? List.copyOf(results) : List.of();
        metadata = metadata != null ? Settings.copyOf(metadata) : Map.of();
    }

    /** Wraps the bare list returned by a legacy retriever. */
    public static RetrievalResponse ofLegacy(List<RetrievalResultEntry> entries) {
        return new RetrievalResponse(entries, Map.of(LEGACY_KEY, true));
    }

    public static RetrievalResponse empty() {
        return new RetrievalResponse(List.of(), Map.of());
    }

    public int size() {
        return results.size();
    }
}
