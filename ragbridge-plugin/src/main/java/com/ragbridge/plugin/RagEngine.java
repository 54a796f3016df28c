package com.ragbridge.plugin;

import com.ragbridge.entities.IngestionContext;
import com.ragbridge.entities.IngestionResult;
import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResponse;
import com.ragbridge.schema.SettingsSchema;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Full RAG engine. One instance serves one knowledge base collection and reaches host infrastructure only through
 * the {@link com.ragbridge.host.HostServices} it was created with.
 * <p>
 * Lifecycle as driven by the host:
 * <ol>
 *   <li>{@link #onKnowledgeBaseCreate} once, with configuration already validated against
 *       {@link #getCreationSettingsSchema()} and completed with its defaults</li>
 *   <li>any number of {@link #ingest}, {@link #deleteDocument} and {@link #retrieve} calls, possibly concurrent</li>
 *   <li>{@link #onKnowledgeBaseDelete} once, after in-flight operations finished; the host removes the
 *       collection's vectors afterwards</li>
 * </ol>
 * Host capability failures must surface as {@link com.ragbridge.errors.HostServiceException}, never swallowed.
 */
public interface RagEngine extends RagComponent {

    @Override
    default ComponentKind getKind() {
        return ComponentKind.RAG_ENGINE;
    }

    /**
     * Called once when the knowledge base is created. Default does nothing.
     *
     * @param knowledgeBaseId knowledge base id
     * @param config          validated creation settings, defaults applied
     */
    default CompletableFuture<Void> onKnowledgeBaseCreate(String knowledgeBaseId, Map<String, Object> config) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Called once before the knowledge base is removed; release plugin-private state here. Default does nothing.
     */
    default CompletableFuture<Void> onKnowledgeBaseDelete(String knowledgeBaseId) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Reads, chunks, embeds and stores one document. Re-ingesting a document id replaces its chunks.
     * Content errors complete with {@link com.ragbridge.errors.IngestionException} subtypes.
     */
    CompletableFuture<IngestionResult> ingest(IngestionContext context);

    /**
     * Removes every chunk of the document.
     *
     * @return true if anything was removed, false if the document had no chunks
     */
    CompletableFuture<Boolean> deleteDocument(String knowledgeBaseId, String documentId);

    /**
     * Retrieves chunks for the query. Settings are validated against {@link #getRetrievalSettingsSchema()} by
     * the host before the call.
     */
    CompletableFuture<RetrievalResponse> retrieve(RetrievalContext context);

    /** Schema for knowledge base creation settings. Must return an equal document on every call. */
    SettingsSchema getCreationSettingsSchema();

    /** Schema for per-request retrieval settings. Must return an equal document on every call. */
    SettingsSchema getRetrievalSettingsSchema();
}
