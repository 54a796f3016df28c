package com.ragbridge.engine.naive;

import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResultEntry;
import com.ragbridge.errors.HostErrors;
import com.ragbridge.errors.RetrievalException;
import com.ragbridge.host.HostServices;
import com.ragbridge.host.SearchHit;
import com.ragbridge.host.VectorStore;
import com.ragbridge.plugin.KnowledgeRetriever;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Legacy retriever: embeds the query and returns the nearest chunks of the bound collection.
 * Reads {@code top_k} from the settings (default 5); distance is {@code 1 - cosineSimilarity}.
 */
public final class VectorKnowledgeRetriever implements KnowledgeRetriever {

    public static final String COMPONENT_ID = "vector-retriever";

    private final HostServices hostServices;

    public VectorKnowledgeRetriever(HostServices hostServices) {
        this.hostServices = Objects.requireNonNull(hostServices, "hostServices");
    }

    @Override
    public CompletableFuture<List<RetrievalResultEntry>> retrieve(RetrievalContext context) {
        String query = context.query().strip();
        if (query.isEmpty()) {
            return CompletableFuture.failedFuture(new RetrievalException("Query must not be blank"));
        }
        int topK = Math.max(1, context.getInt(NaiveRagEngine.TOP_K, VectorStore.DEFAULT_TOP_K));
        return hostServices.getEmbedder().embedQuery(query)
                .thenCompose(vector -> hostServices.getVectorStore().search(hostServices.getCollectionId(), vector, topK, null))
                .exceptionally(error -> {
                    throw HostErrors.asCompletion(HostErrors.toPluginFailure("search " + hostServices.getCollectionId(), error));
                })
                .thenApply(hits -> {
                    List<RetrievalResultEntry> entries = new ArrayList<>(hits.size());
                    for (SearchHit hit : hits) {
                        entries.add(new RetrievalResultEntry(hit.id(), hit.metadata(), hit.distance()));
                    }
                    return entries;
                });
    }
}
