package com.ragbridge.plugin;

import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResultEntry;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Legacy retrieval-only component. Takes no part in knowledge base lifecycle or ingestion; settings in the
 * retrieval context are passed through without schema validation.
 */
public interface KnowledgeRetriever extends RagComponent {

    @Override
    default ComponentKind getKind() {
        return ComponentKind.KNOWLEDGE_RETRIEVER;
    }

    /**
     * Returns matching chunks ordered by ascending {@link RetrievalResultEntry#distance()}.
     */
    CompletableFuture<List<RetrievalResultEntry>> retrieve(RetrievalContext context);
}
