package com.ragbridge.plugin;

import com.ragbridge.entities.IngestionContext;
import com.ragbridge.entities.IngestionResult;
import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResponse;
import com.ragbridge.entities.RetrievalResultEntry;
import com.ragbridge.host.HostServices;
import com.ragbridge.schema.SettingsSchema;

import java.util.List;
import java.util.concurrent.CompletableFuture;

final class StubComponents {

    private StubComponents() {
    }

    static final class EmptyRetriever implements KnowledgeRetriever {
        @Override
        public CompletableFuture<List<RetrievalResultEntry>> retrieve(RetrievalContext context) {
            return CompletableFuture.completedFuture(List.of());
        }
    }

    static final class EmptyEngine implements RagEngine {
        @Override
        public CompletableFuture<IngestionResult> ingest(IngestionContext context) {
            return CompletableFuture.completedFuture(IngestionResult.completed(context.documentId(), 0, null));
        }

        @Override
        public CompletableFuture<Boolean> deleteDocument(String knowledgeBaseId, String documentId) {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<RetrievalResponse> retrieve(RetrievalContext context) {
            return CompletableFuture.completedFuture(RetrievalResponse.empty());
        }

        @Override
        public SettingsSchema getCreationSettingsSchema() {
            return SettingsSchema.EMPTY;
        }

        @Override
        public SettingsSchema getRetrievalSettingsSchema() {
            return SettingsSchema.EMPTY;
        }
    }

    /** Provider whose instances may disagree with the declared kind. */
    static ComponentProvider provider(String id, ComponentKind kind, RagComponent instance) {
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
                return instance;
            }
        };
    }

    /** Discovered through META-INF/services in the test classpath. */
    public static final class DiscoverableProvider implements ComponentProvider {
        @Override
        public String getComponentId() {
            return "discoverable-retriever";
        }

        @Override
        public ComponentKind getKind() {
            return ComponentKind.KNOWLEDGE_RETRIEVER;
        }

        @Override
        public RagComponent create(HostServices hostServices) {
            return new EmptyRetriever();
        }
    }

    /** Discovered but disabled. */
    public static final class DisabledProvider implements ComponentProvider {
        @Override
        public String getComponentId() {
            return "disabled-engine";
        }

        @Override
        public ComponentKind getKind() {
            return ComponentKind.RAG_ENGINE;
        }

        @Override
        public RagComponent create(HostServices hostServices) {
            return new EmptyEngine();
        }

        @Override
        public boolean isEnabled() {
            return false;
        }
    }
}
