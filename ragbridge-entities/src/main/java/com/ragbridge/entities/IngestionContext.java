package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Input to {@code RagEngine.ingest}. Built by the host for a single call and not retained by the plugin.
 * <p>
 * {@link #chunkingStrategy()} overrides the knowledge base creation settings for this document only;
 * {@link #creationSettings()} carries the validated settings the knowledge base was created with.
 */
public record IngestionContext(
        @JsonProperty("document_id") String documentId,
        @JsonProperty("knowledge_base_id") String knowledgeBaseId,
        @JsonProperty("file_object") FileObject fileObject,
        @JsonProperty("chunking_strategy") Map<String, Object> chunkingStrategy,
        @JsonProperty("creation_settings") Map<String, Object> creationSettings
) {
    public IngestionContext {
        documentId = Objects.requireNonNull(documentId, "documentId").trim();
        if (documentId.isEmpty()) {
            throw new IllegalArgumentException("documentId must be non-blank");
        }
        Objects.requireNonNull(fileObject, "fileObject");
        chunkingStrategy = chunkingStrategy != null ? Settings.copyOf(chunkingStrategy) : Map.of();
        creationSettings = creationSettings != null ? Settings.copyOf(creationSettings) : Map.of();
    }

    public IngestionContext(String documentId, String knowledgeBaseId, FileObject fileObject) {
        this(documentId, knowledgeBaseId, fileObject, Map.of(), Map.of());
    }

    /**
     * Creation settings with this call's chunking strategy laid over them.
     */
    public Map<String, Object> effectiveChunkingSettings() {
        return Settings.merge(creationSettings, chunkingStrategy);
    }

    /** Returns a copy carrying the given creation settings (used by the host after schema validation). */
    public IngestionContext withCreationSettings(Map<String, Object> settings) {
        return new IngestionContext(documentId, knowledgeBaseId, fileObject, chunkingStrategy, settings);
    }
}
