package com.ragbridge.bootstrap;

import com.ragbridge.config.RagBridgeConfig;
import com.ragbridge.embedding.ollama.OllamaEmbedder;
import com.ragbridge.host.Embedder;
import com.ragbridge.host.VectorStore;
import com.ragbridge.host.kb.KnowledgeBaseService;
import com.ragbridge.host.local.HashingEmbedder;
import com.ragbridge.host.local.InMemoryVectorStore;
import com.ragbridge.host.local.LocalFileStorage;
import com.ragbridge.plugin.ComponentRegistry;
import com.ragbridge.vectorstore.qdrant.QdrantVectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Builds a {@link KnowledgeBaseService} from configuration: picks the embedder and vector store backends,
 * roots file storage at the configured directory and registers the available components.
 */
public final class RagBridgeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RagBridgeBootstrap.class);

    private RagBridgeBootstrap() {
    }

    /** Loads {@link RagBridgeConfig} from the environment and builds the service. */
    public static KnowledgeBaseService initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return createKnowledgeBaseService(RagBridgeConfig.fromEnvironment());
    }

    public static KnowledgeBaseService createKnowledgeBaseService(RagBridgeConfig config) {
        return createKnowledgeBaseService(config, new SimpleMeterRegistry());
    }

    public static KnowledgeBaseService createKnowledgeBaseService(RagBridgeConfig config, MeterRegistry meterRegistry) {
        log.info("Bootstrap: {}", config);
        ComponentRegistry registry = InternalComponents.registerAll(new ComponentRegistry(),
                RagBridgeBootstrap.class.getClassLoader());
        Path storageRoot = Path.of(config.getStorageDir()).toAbsolutePath().normalize();
        return new KnowledgeBaseService(registry, createEmbedder(config), createVectorStore(config),
                new LocalFileStorage(storageRoot), meterRegistry);
    }

    static Embedder createEmbedder(RagBridgeConfig config) {
        if (RagBridgeConfig.EMBEDDER_OLLAMA.equals(config.getEmbedder())) {
            log.info("Embedder: Ollama {} model={}", config.getOllamaBaseUrl(), config.getOllamaEmbeddingModel());
            return new OllamaEmbedder(config.getOllamaBaseUrl(), config.getOllamaEmbeddingModel());
        }
        log.info("Embedder: hashing dimension={}", config.getHashingDimension());
        return new HashingEmbedder(config.getHashingDimension());
    }

    static VectorStore createVectorStore(RagBridgeConfig config) {
        if (RagBridgeConfig.VECTOR_STORE_QDRANT.equals(config.getVectorStore())) {
            log.info("Vector store: Qdrant {} vectorSize={}", config.getQdrantBaseUrl(), config.getQdrantVectorSize());
            return new QdrantVectorStore(config.getQdrantBaseUrl(), config.getQdrantVectorSize());
        }
        log.info("Vector store: in-memory");
        return new InMemoryVectorStore();
    }
}
