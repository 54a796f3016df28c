package com.ragbridge.host.kb;

import com.ragbridge.entities.FileObject;
import com.ragbridge.entities.IngestionContext;
import com.ragbridge.entities.IngestionResult;
import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResponse;
import com.ragbridge.entities.RetrievalResultEntry;
import com.ragbridge.host.HostServices;
import com.ragbridge.host.local.HashingEmbedder;
import com.ragbridge.host.local.InMemoryVectorStore;
import com.ragbridge.host.local.LocalFileStorage;
import com.ragbridge.plugin.ComponentKind;
import com.ragbridge.plugin.ComponentProvider;
import com.ragbridge.plugin.ComponentRegistry;
import com.ragbridge.plugin.KnowledgeRetriever;
import com.ragbridge.plugin.RagComponent;
import com.ragbridge.plugin.RagEngine;
import com.ragbridge.schema.InvalidSettingsException;
import com.ragbridge.schema.SettingsSchema;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeBaseServiceTest {

    @TempDir
    Path root;

    private final List<String> events = new ArrayList<>();
    private final List<Map<String, Object>> seenSettings = new ArrayList<>();
    private RecordingEngine engine;
    private InMemoryVectorStore store;
    private SimpleMeterRegistry meters;
    private KnowledgeBaseService service;

    @BeforeEach
    void setUp() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.register(provider("recording", ComponentKind.RAG_ENGINE, hs -> engine = new RecordingEngine(hs)));
        registry.register(provider("legacy", ComponentKind.KNOWLEDGE_RETRIEVER, hs -> new FixedRetriever()));
        store = new InMemoryVectorStore();
        meters = new SimpleMeterRegistry();
        service = new KnowledgeBaseService(registry, new HashingEmbedder(8), store, new LocalFileStorage(root), meters);
    }

    @Test
    void create_validatesConfigAppliesDefaultsAndActivates() {
        service.createKnowledgeBase("kb-1", "recording", Map.of("index_mode", "paragraph")).join();

        assertEquals(KnowledgeBaseState.ACTIVE, service.getState("kb-1"));
        assertEquals(Map.of("index_mode", "paragraph", "chunk_size", 512), service.getConfig("kb-1"));
        assertEquals(List.of("create:kb-1"), events);
        assertTrue(store.hasCollection("kb-1"));
        assertEquals("kb-1", engine.hostServices.getCollectionId());
    }

    @Test
    void create_rejectsInvalidConfigWithoutCallingHook() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.createKnowledgeBase("kb-1", "recording", Map.of("chunk_size", 5)).join());

        assertInstanceOf(InvalidSettingsException.class, thrown.getCause());
        assertEquals(KnowledgeBaseState.ABSENT, service.getState("kb-1"));
        assertTrue(events.isEmpty());
        assertFalse(store.hasCollection("kb-1"));
    }

    @Test
    void create_rejectsDuplicateAndUnknownComponent() {
        service.createKnowledgeBase("kb-1", "recording", Map.of()).join();

        assertThrows(CompletionException.class, () -> service.createKnowledgeBase("kb-1", "recording", Map.of()).join());
        CompletionException unknown = assertThrows(CompletionException.class,
                () -> service.createKnowledgeBase("kb-2", "nope", Map.of()).join());
        assertInstanceOf(IllegalArgumentException.class, unknown.getCause());
    }

    @Test
    void create_hookFailureRemovesKnowledgeBaseAndCollection() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.register(provider("failing", ComponentKind.RAG_ENGINE, hs -> new RecordingEngine(hs) {
            @Override
            public CompletableFuture<Void> onKnowledgeBaseCreate(String knowledgeBaseId, Map<String, Object> config) {
                return CompletableFuture.failedFuture(new IllegalStateException("no"));
            }
        }));
        KnowledgeBaseService failing = new KnowledgeBaseService(registry, new HashingEmbedder(8), store,
                new LocalFileStorage(root));

        assertThrows(CompletionException.class, () -> failing.createKnowledgeBase("kb-x", "failing", Map.of()).join());
        assertEquals(KnowledgeBaseState.ABSENT, failing.getState("kb-x"));
        assertFalse(store.hasCollection("kb-x"));
    }

    @Test
    void retrieve_appliesRetrievalDefaultsForEngines() {
        service.createKnowledgeBase("kb-1", "recording", Map.of()).join();

        RetrievalResponse response = service.retrieve(new RetrievalContext("q", "kb-1", Map.of("extra", "x"))).join();

        assertEquals(0, response.size());
        assertEquals(Map.of("extra", "x", "top_k", 5), seenSettings.get(0));
        assertThrows(CompletionException.class,
                () -> service.retrieve(new RetrievalContext("q", "kb-1", Map.of("top_k", 0))).join());
    }

    @Test
    void retrieve_wrapsLegacyRetrieverResults() {
        service.createKnowledgeBase("kb-legacy", "legacy", Map.of("anything", true)).join();

        RetrievalResponse response = service.retrieve(new RetrievalContext("q", "kb-legacy", Map.of("top_k", 0))).join();

        assertEquals(1, response.size());
        assertEquals(true, response.metadata().get(RetrievalResponse.LEGACY_KEY));
        assertEquals(Map.of("anything", true), service.getConfig("kb-legacy"));
        assertEquals(ComponentKind.KNOWLEDGE_RETRIEVER, service.getKind("kb-legacy"));
    }

    @Test
    void ingest_onlyLegalForEngines() {
        service.createKnowledgeBase("kb-legacy", "legacy", Map.of()).join();

        CompletionException thrown = assertThrows(CompletionException.class, () -> service.ingest(
                new IngestionContext("doc", "kb-legacy", FileObject.of("doc.txt"))).join());

        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        assertThrows(CompletionException.class, () -> service.deleteDocument("kb-legacy", "doc").join());
    }

    @Test
    void ingest_passesStoredCreationSettingsAndChecksOverrides() {
        service.createKnowledgeBase("kb-1", "recording", Map.of("chunk_size", 300)).join();

        IngestionResult result = service.ingest(new IngestionContext("doc", "kb-1", FileObject.of("doc.txt"))).join();
        assertTrue(result.isSuccess());
        assertEquals(300, engine.lastIngest.creationSettings().get("chunk_size"));

        CompletionException bad = assertThrows(CompletionException.class, () -> service.ingest(new IngestionContext(
                "doc", "kb-1", FileObject.of("doc.txt"), Map.of("chunk_size", 1), null)).join());
        assertInstanceOf(InvalidSettingsException.class, bad.getCause());
    }

    @Test
    void ingest_handsValidatedOverrideWithDefaultsToEngine() {
        service.createKnowledgeBase("kb-1", "recording", Map.of("chunk_size", 300)).join();

        service.ingest(new IngestionContext("doc", "kb-1", FileObject.of("doc.txt"),
                Map.of("chunk_size", 150), null)).join();

        assertEquals(150, engine.lastIngest.creationSettings().get("chunk_size"));
        assertEquals("general", engine.lastIngest.creationSettings().get("index_mode"));
        assertEquals(300, service.getConfig("kb-1").get("chunk_size"));
    }

    @Test
    void nullContexts_failTheReturnedFuture() {
        CompletableFuture<IngestionResult> ingest = service.ingest(null);
        CompletableFuture<RetrievalResponse> retrieve = service.retrieve(null);

        assertInstanceOf(NullPointerException.class, assertThrows(CompletionException.class, ingest::join).getCause());
        assertInstanceOf(NullPointerException.class, assertThrows(CompletionException.class, retrieve::join).getCause());
    }

    @Test
    void delete_waitsForInFlightThenCallsHookThenDropsCollection() {
        service.createKnowledgeBase("kb-1", "recording", Map.of()).join();
        engine.pendingDelete = new CompletableFuture<>();
        CompletableFuture<Boolean> inFlight = service.deleteDocument("kb-1", "doc");

        CompletableFuture<Void> deletion = service.deleteKnowledgeBase("kb-1");

        assertFalse(deletion.isDone());
        assertEquals(KnowledgeBaseState.DELETED, service.getState("kb-1"));
        CompletionException rejected = assertThrows(CompletionException.class,
                () -> service.retrieve(new RetrievalContext("q", "kb-1", Map.of())).join());
        assertInstanceOf(IllegalStateException.class, rejected.getCause());
        assertFalse(events.contains("delete:kb-1"));

        engine.pendingDelete.complete(true);
        deletion.join();

        assertTrue(inFlight.join());
        assertEquals(List.of("create:kb-1", "delete_document:doc", "delete:kb-1"), events);
        assertFalse(store.hasCollection("kb-1"));
        assertEquals(KnowledgeBaseState.ABSENT, service.getState("kb-1"));
    }

    @Test
    void operationsOnUnknownKnowledgeBaseFail() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.retrieve(new RetrievalContext("q", "missing", Map.of())).join());

        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        assertThrows(CompletionException.class, () -> service.deleteKnowledgeBase("missing").join());
    }

    @Test
    void operationsAreTimed() {
        service.createKnowledgeBase("kb-1", "recording", Map.of()).join();
        service.retrieve(new RetrievalContext("q", "kb-1", Map.of())).join();

        assertNotNull(meters.find(KnowledgeBaseService.OPERATION_TIMER)
                .tags("component", "recording", "kind", "RAGEngine", "operation", "retrieve", "outcome", "success")
                .timer());
        assertEquals(1, meters.find(KnowledgeBaseService.OPERATION_TIMER).tag("operation", "create").timer().count());
    }

    private static ComponentProvider provider(String id, ComponentKind kind,
                                              java.util.function.Function<HostServices, RagComponent> factory) {
        return new ComponentProvider() {
            @Override
            public String getComponentId() {
                return id;
            }

            @Override
            public ComponentKind getKind() {
                return kind;
            }

            @Override
            public RagComponent create(HostServices hostServices) {
                return factory.apply(hostServices);
            }
        };
    }

    private class RecordingEngine implements RagEngine {
        final HostServices hostServices;
        IngestionContext lastIngest;
        CompletableFuture<Boolean> pendingDelete;

        RecordingEngine(HostServices hostServices) {
            this.hostServices = hostServices;
        }

        @Override
        public CompletableFuture<Void> onKnowledgeBaseCreate(String knowledgeBaseId, Map<String, Object> config) {
            events.add("create:" + knowledgeBaseId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> onKnowledgeBaseDelete(String knowledgeBaseId) {
            events.add("delete:" + knowledgeBaseId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<IngestionResult> ingest(IngestionContext context) {
            lastIngest = context;
            return CompletableFuture.completedFuture(IngestionResult.completed(context.documentId(), 0, null));
        }

        @Override
        public CompletableFuture<Boolean> deleteDocument(String knowledgeBaseId, String documentId) {
            events.add("delete_document:" + documentId);
            return pendingDelete != null ? pendingDelete : CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<RetrievalResponse> retrieve(RetrievalContext context) {
            seenSettings.add(context.settings());
            return CompletableFuture.completedFuture(RetrievalResponse.empty());
        }

        @Override
        public SettingsSchema getCreationSettingsSchema() {
            return SettingsSchema.builder()
                    .stringEnum("index_mode", "Index mode", List.of("general", "paragraph"), "general")
                    .integer("chunk_size", "Chunk size", 100, 2000, 512)
                    .required("index_mode")
                    .build();
        }

        @Override
        public SettingsSchema getRetrievalSettingsSchema() {
            return SettingsSchema.builder()
                    .integer("top_k", "Top K", 1, 100, 5)
                    .build();
        }
    }

    private static final class FixedRetriever implements KnowledgeRetriever {
        @Override
        public CompletableFuture<List<RetrievalResultEntry>> retrieve(RetrievalContext context) {
            return CompletableFuture.completedFuture(List.of(new RetrievalResultEntry("c-1", Map.of("text", "t"), 0.1)));
        }
    }
}
