package com.ragbridge.host.kb;

import com.ragbridge.entities.IngestionContext;
import com.ragbridge.entities.IngestionResult;
import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResponse;
import com.ragbridge.entities.Settings;
import com.ragbridge.errors.HostErrors;
import com.ragbridge.host.CollectionAdmin;
import com.ragbridge.host.Embedder;
import com.ragbridge.host.FileStorage;
import com.ragbridge.host.VectorStore;
import com.ragbridge.host.services.ScopedHostServices;
import com.ragbridge.plugin.ComponentKind;
import com.ragbridge.plugin.ComponentRegistry;
import com.ragbridge.plugin.KnowledgeRetriever;
import com.ragbridge.plugin.RagComponent;
import com.ragbridge.plugin.RagEngine;
import com.ragbridge.schema.SettingsValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Host-side coordinator of knowledge bases. Binds each knowledge base to one component instance and one collection,
 * validates settings against the engine's schemas, and drives the lifecycle
 * {@code ABSENT -> CREATED -> ACTIVE -> DELETED}.
 * <p>
 * Every method returns a future; precondition failures (unknown or deleted knowledge base, wrong component kind)
 * complete it with {@link IllegalStateException}, invalid settings with
 * {@link com.ragbridge.schema.InvalidSettingsException}. Operations are timed under
 * {@value #OPERATION_TIMER} with tags {@code component}, {@code kind}, {@code operation}, {@code outcome}.
 */
public final class KnowledgeBaseService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseService.class);

    public static final String OPERATION_TIMER = "ragbridge.component.operation";

    private final ComponentRegistry registry;
    private final Embedder embedder;
    private final VectorStore vectorStore;
    private final FileStorage fileStorage;
    private final MeterRegistry meterRegistry;
    private final Map<String, KnowledgeBase> knowledgeBases = new ConcurrentHashMap<>();

    public KnowledgeBaseService(ComponentRegistry registry, Embedder embedder, VectorStore vectorStore,
                                FileStorage fileStorage) {
        this(registry, embedder, vectorStore, fileStorage, new SimpleMeterRegistry());
    }

    public KnowledgeBaseService(ComponentRegistry registry, Embedder embedder, VectorStore vectorStore,
                                FileStorage fileStorage, MeterRegistry meterRegistry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.fileStorage = Objects.requireNonNull(fileStorage, "fileStorage");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /**
     * Creates a knowledge base served by the given component. For a {@code RAGEngine} the config is validated
     * against its creation schema with defaults applied before {@code onKnowledgeBaseCreate}; for a legacy
     * retriever it is stored as given.
     *
     * @return future completing when the knowledge base is ACTIVE
     */
    public CompletableFuture<Void> createKnowledgeBase(String knowledgeBaseId, String componentId,
                                                       Map<String, Object> config) {
        if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("knowledgeBaseId must be non-blank"));
        }
        String kbId = knowledgeBaseId.trim();
        KnowledgeBase kb;
        try {
            ScopedHostServices services = new ScopedHostServices(kbId, embedder, vectorStore, fileStorage);
            RagComponent component = registry.create(componentId, services);
            Map<String, Object> settings = component instanceof RagEngine
                    ? SettingsValidator.validateAndApplyDefaults("creation settings of " + componentId,
                            ((RagEngine) component).getCreationSettingsSchema(), config)
                    : Settings.copyOf(config);
            kb = new KnowledgeBase(kbId, componentId.trim(), component, services, settings);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        KnowledgeBase existing = knowledgeBases.putIfAbsent(kbId, kb);
        if (existing != null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Knowledge base already exists: " + kbId + " (" + existing.state + ")"));
        }
        return timed(kb, "create", () -> createCollection(kbId)
                .thenCompose(ignored -> kb.component instanceof RagEngine
                        ? ((RagEngine) kb.component).onKnowledgeBaseCreate(kbId, kb.config)
                        : CompletableFuture.<Void>completedFuture(null)))
                .<CompletableFuture<Void>>handle((ignored, error) -> {
                    if (error == null) {
                        kb.activate();
                        log.info("Knowledge base {} active (component {}, {})", kbId, kb.componentId, kb.kind().getTag());
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = HostErrors.unwrap(error);
                    log.warn("Knowledge base {} creation failed: {}", kbId, cause.getMessage());
                    knowledgeBases.remove(kbId, kb);
                    return dropCollection(kbId).<Void>handle((dropped, dropError) -> {
                        if (dropError != null) cause.addSuppressed(HostErrors.unwrap(dropError));
                        throw HostErrors.asCompletion(cause);
                    });
                })
                .thenCompose(f -> f);
    }

    /**
     * Ingests a document into {@code context.knowledgeBaseId()}. Only legal for {@code RAGEngine} components.
     * The per-document chunking strategy, laid over the stored creation settings, must satisfy the creation schema;
     * the engine receives that validated, default-filled merge as the context's creation settings.
     */
    public CompletableFuture<IngestionResult> ingest(IngestionContext context) {
        if (context == null) {
            return CompletableFuture.failedFuture(new NullPointerException("context"));
        }
        return withEngine(context.knowledgeBaseId(), "ingest", (kb, engine) -> {
            Map<String, Object> effective = SettingsValidator.validateAndApplyDefaults(
                    "chunking strategy of " + context.documentId(),
                    engine.getCreationSettingsSchema(), Settings.merge(kb.config, context.chunkingStrategy()));
            return engine.ingest(context.withCreationSettings(effective));
        });
    }

    /** Removes a document's chunks. Only legal for {@code RAGEngine} components. */
    public CompletableFuture<Boolean> deleteDocument(String knowledgeBaseId, String documentId) {
        return withEngine(knowledgeBaseId, "delete_document",
                (kb, engine) -> engine.deleteDocument(kb.id, documentId));
    }

    /**
     * Retrieves from a knowledge base. Engine settings are validated against the retrieval schema with defaults
     * applied; a legacy retriever receives them unchanged and its list result is wrapped with
     * {@link RetrievalResponse#ofLegacy}.
     */
    public CompletableFuture<RetrievalResponse> retrieve(RetrievalContext context) {
        if (context == null) {
            return CompletableFuture.failedFuture(new NullPointerException("context"));
        }
        KnowledgeBase kb;
        try {
            kb = requireActive(context.knowledgeBaseId());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return guarded(kb, "retrieve", () -> {
            RetrievalContext bound = new RetrievalContext(context.query(), kb.id, kb.services.getCollectionId(),
                    context.settings());
            if (kb.component instanceof RagEngine) {
                RagEngine engine = (RagEngine) kb.component;
                Map<String, Object> settings = SettingsValidator.validateAndApplyDefaults(
                        "retrieval settings of " + kb.componentId, engine.getRetrievalSettingsSchema(), bound.settings());
                return engine.retrieve(bound.withSettings(settings));
            }
            return ((KnowledgeRetriever) kb.component).retrieve(bound).thenApply(RetrievalResponse::ofLegacy);
        });
    }

    /**
     * Deletes a knowledge base: rejects new operations, waits for in-flight ones, calls
     * {@code onKnowledgeBaseDelete}, then removes the collection. The collection is removed even if the hook fails;
     * the hook's failure still fails the returned future.
     */
    public CompletableFuture<Void> deleteKnowledgeBase(String knowledgeBaseId) {
        KnowledgeBase kb = knowledgeBaseId != null ? knowledgeBases.get(knowledgeBaseId.trim()) : null;
        if (kb == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Unknown knowledge base: " + knowledgeBaseId));
        }
        CompletableFuture<Void> drained;
        try {
            drained = kb.beginDelete();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return timed(kb, "delete", () -> drained
                .thenCompose(ignored -> kb.component instanceof RagEngine
                        ? ((RagEngine) kb.component).onKnowledgeBaseDelete(kb.id)
                        : CompletableFuture.<Void>completedFuture(null))
                .<CompletableFuture<Void>>handle((ignored, hookError) -> dropCollection(kb.id).<Void>handle((dropped, dropError) -> {
                    knowledgeBases.remove(kb.id, kb);
                    if (hookError != null) {
                        Throwable cause = HostErrors.unwrap(hookError);
                        if (dropError != null) cause.addSuppressed(HostErrors.unwrap(dropError));
                        throw HostErrors.asCompletion(cause);
                    }
                    if (dropError != null) throw HostErrors.asCompletion(HostErrors.unwrap(dropError));
                    log.info("Knowledge base {} deleted", kb.id);
                    return (Void) null;
                }))
                .thenCompose(f -> f));
    }

    /** Current lifecycle state; {@link KnowledgeBaseState#ABSENT} for unknown ids. */
    public KnowledgeBaseState getState(String knowledgeBaseId) {
        KnowledgeBase kb = knowledgeBaseId != null ? knowledgeBases.get(knowledgeBaseId.trim()) : null;
        return kb != null ? kb.state : KnowledgeBaseState.ABSENT;
    }

    /** Validated creation settings the knowledge base was created with. */
    public Map<String, Object> getConfig(String knowledgeBaseId) {
        return require(knowledgeBaseId).config;
    }

    /** Kind of the component serving the knowledge base. */
    public ComponentKind getKind(String knowledgeBaseId) {
        return require(knowledgeBaseId).kind();
    }

    /** File streams the knowledge base's component opened and has not closed. */
    public int getOpenFileStreamCount(String knowledgeBaseId) {
        return require(knowledgeBaseId).services.getOpenFileStreamCount();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private <T> CompletableFuture<T> withEngine(String knowledgeBaseId, String operation, EngineCall<T> call) {
        KnowledgeBase kb;
        try {
            kb = requireActive(knowledgeBaseId);
            if (!(kb.component instanceof RagEngine)) {
                throw new IllegalStateException("Knowledge base " + kb.id + " is served by a "
                        + kb.kind().getTag() + "; " + operation + " requires a RAGEngine");
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return guarded(kb, operation, () -> call.apply(kb, (RagEngine) kb.component));
    }

    private <T> CompletableFuture<T> guarded(KnowledgeBase kb, String operation, Supplier<CompletableFuture<T>> call) {
        try {
            kb.enter();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return timed(kb, operation, call).whenComplete((value, error) -> kb.exit());
    }

    private <T> CompletableFuture<T> timed(KnowledgeBase kb, String operation, Supplier<CompletableFuture<T>> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<T> future;
        try {
            future = Objects.requireNonNull(call.get(), operation + " returned null");
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((value, error) -> sample.stop(Timer.builder(OPERATION_TIMER)
                .tag("component", kb.componentId)
                .tag("kind", kb.kind().getTag())
                .tag("operation", operation)
                .tag("outcome", error == null ? "success" : "error")
                .register(meterRegistry)));
    }

    private CompletableFuture<Void> createCollection(String collectionId) {
        return vectorStore instanceof CollectionAdmin
                ? ((CollectionAdmin) vectorStore).createCollection(collectionId)
                : CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> dropCollection(String collectionId) {
        if (vectorStore instanceof CollectionAdmin) {
            return ((CollectionAdmin) vectorStore).dropCollection(collectionId);
        }
        return vectorStore.delete(collectionId, null, Map.of()).thenApply(removed -> null);
    }

    private KnowledgeBase require(String knowledgeBaseId) {
        KnowledgeBase kb = knowledgeBaseId != null ? knowledgeBases.get(knowledgeBaseId.trim()) : null;
        if (kb == null) {
            throw new IllegalStateException("Unknown knowledge base: " + knowledgeBaseId);
        }
        return kb;
    }

    private KnowledgeBase requireActive(String knowledgeBaseId) {
        KnowledgeBase kb = require(knowledgeBaseId);
        if (kb.state != KnowledgeBaseState.ACTIVE) {
            throw new IllegalStateException("Knowledge base " + kb.id + " is " + kb.state);
        }
        return kb;
    }

    @FunctionalInterface
    private interface EngineCall<T> {
        CompletableFuture<T> apply(KnowledgeBase kb, RagEngine engine);
    }

    private static final class KnowledgeBase {
        private final String id;
        private final String componentId;
        private final RagComponent component;
        private final ScopedHostServices services;
        private final Map<String, Object> config;
        private volatile KnowledgeBaseState state = KnowledgeBaseState.CREATED;
        private int inFlight;
        private CompletableFuture<Void> drained;

        KnowledgeBase(String id, String componentId, RagComponent component, ScopedHostServices services,
                      Map<String, Object> config) {
            this.id = id;
            this.componentId = componentId;
            this.component = component;
            this.services = services;
            this.config = config;
        }

        ComponentKind kind() {
            return component.getKind();
        }

        synchronized void activate() {
            if (state == KnowledgeBaseState.CREATED) state = KnowledgeBaseState.ACTIVE;
        }

        synchronized void enter() {
            if (state != KnowledgeBaseState.ACTIVE) {
                throw new IllegalStateException("Knowledge base " + id + " is " + state);
            }
            inFlight++;
        }

        void exit() {
            CompletableFuture<Void> toComplete = null;
            synchronized (this) {
                inFlight--;
                if (inFlight == 0 && drained != null) toComplete = drained;
            }
            if (toComplete != null) toComplete.complete(null);
        }

        synchronized CompletableFuture<Void> beginDelete() {
            if (state != KnowledgeBaseState.ACTIVE) {
                throw new IllegalStateException("Knowledge base " + id + " is " + state);
            }
            state = KnowledgeBaseState.DELETED;
            drained = new CompletableFuture<>();
            if (inFlight == 0) drained.complete(null);
            return drained;
        }
    }
}
