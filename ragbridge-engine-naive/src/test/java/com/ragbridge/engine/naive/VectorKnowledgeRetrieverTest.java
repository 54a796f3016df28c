package com.ragbridge.engine.naive;

import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResultEntry;
import com.ragbridge.errors.CollectionNotFoundException;
import com.ragbridge.errors.HostServiceException;
import com.ragbridge.errors.RetrievalException;
import com.ragbridge.host.local.HashingEmbedder;
import com.ragbridge.host.local.InMemoryVectorStore;
import com.ragbridge.host.local.LocalFileStorage;
import com.ragbridge.host.services.ScopedHostServices;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VectorKnowledgeRetrieverTest {

    @TempDir
    Path root;

    @Test
    void retrieve_returnsNearestFirstWithDefaultTopK() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.createCollection("kb").join();
        HashingEmbedder embedder = new HashingEmbedder();
        for (int i = 0; i < 8; i++) {
            store.upsert("kb", List.of("n-" + i), List.of(embedder.embedQuery("note " + i).join()),
                    List.of(Map.of("text", "note " + i))).join();
        }
        VectorKnowledgeRetriever retriever = new VectorKnowledgeRetriever(
                new ScopedHostServices("kb", embedder, store, new LocalFileStorage(root)));

        List<RetrievalResultEntry> entries = retriever.retrieve(new RetrievalContext("note 3", "kb", Map.of())).join();

        assertEquals(5, entries.size());
        assertEquals("n-3", entries.get(0).id());
        assertEquals("note 3", entries.get(0).text());
    }

    @Test
    void retrieve_blankQueryIsRetrievalError() {
        VectorKnowledgeRetriever retriever = new VectorKnowledgeRetriever(
                new ScopedHostServices("kb", new HashingEmbedder(), new InMemoryVectorStore(), new LocalFileStorage(root)));

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> retriever.retrieve(new RetrievalContext(" ", "kb", Map.of())).join());

        assertInstanceOf(RetrievalException.class, thrown.getCause());
    }

    @Test
    void retrieve_missingCollectionIsNonRetryableHostError() {
        VectorKnowledgeRetriever retriever = new VectorKnowledgeRetriever(
                new ScopedHostServices("kb", new HashingEmbedder(), new InMemoryVectorStore(), new LocalFileStorage(root)));

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> retriever.retrieve(new RetrievalContext("q", "kb", Map.of())).join());

        HostServiceException wrapped = assertInstanceOf(HostServiceException.class, thrown.getCause());
        assertInstanceOf(CollectionNotFoundException.class, wrapped.getHostCause());
        assertFalse(wrapped.isRetryable());
    }
}
