package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Result of {@code RagEngine.ingest}. Owned by the host after return (bookkeeping, telemetry).
 * A {@link IngestionStatus#COMPLETED} result means every reported chunk is stored and queryable;
 * a {@link IngestionStatus#FAILED} result means no vectors from the attempt remain.
 */
public record IngestionResult(
        @JsonProperty("document_id") String documentId,
        @JsonProperty("status") IngestionStatus status,
        @JsonProperty("chunk_count") int chunkCount,
        @JsonProperty("message") String message,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public IngestionResult {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(status, "status");
        if (chunkCount < 0) {
            throw new IllegalArgumentException("chunkCount must be >= 0");
        }
        metadata = metadata != null ? Settings.copyOf(metadata) : Map.of();
    }

    public static IngestionResult completed(String documentId, int chunkCount, Map<String, Object> metadata) {
        return new IngestionResult(documentId, IngestionStatus.COMPLETED, chunkCount, null, metadata);
    }

    public static IngestionResult failed(String documentId, String message) {
        return new IngestionResult(documentId, IngestionStatus.FAILED, 0, message, Map.of());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == IngestionStatus.COMPLETED;
    }
}
