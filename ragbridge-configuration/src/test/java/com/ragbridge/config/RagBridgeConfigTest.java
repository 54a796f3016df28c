package com.ragbridge.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RagBridgeConfigTest {

    @Test
    void emptyEnvironmentUsesDefaults() {
        RagBridgeConfig config = RagBridgeConfig.fromEnvironment(Map.of());

        assertEquals(RagBridgeConfig.EMBEDDER_HASHING, config.getEmbedder());
        assertEquals(256, config.getHashingDimension());
        assertEquals("http://localhost:11434", config.getOllamaBaseUrl());
        assertEquals("nomic-embed-text", config.getOllamaEmbeddingModel());
        assertEquals(RagBridgeConfig.VECTOR_STORE_MEMORY, config.getVectorStore());
        assertEquals("http://localhost:6333", config.getQdrantBaseUrl());
        assertEquals(768, config.getQdrantVectorSize());
        assertEquals("data/files", config.getStorageDir());
    }

    @Test
    void readsAllVariables() {
        RagBridgeConfig config = RagBridgeConfig.fromEnvironment(Map.of(
                "RAGBRIDGE_EMBEDDER", " Ollama ",
                "RAGBRIDGE_HASHING_DIMENSION", "64",
                "OLLAMA_BASE_URL", "http://ollama:11434",
                "OLLAMA_EMBEDDING_MODEL", "mxbai-embed-large",
                "RAGBRIDGE_VECTOR_STORE", "qdrant",
                "QDRANT_BASE_URL", "http://qdrant:6333",
                "QDRANT_VECTOR_SIZE", "1024",
                "RAGBRIDGE_STORAGE_DIR", "/srv/files"));

        assertEquals(RagBridgeConfig.EMBEDDER_OLLAMA, config.getEmbedder());
        assertEquals(64, config.getHashingDimension());
        assertEquals("http://ollama:11434", config.getOllamaBaseUrl());
        assertEquals("mxbai-embed-large", config.getOllamaEmbeddingModel());
        assertEquals(RagBridgeConfig.VECTOR_STORE_QDRANT, config.getVectorStore());
        assertEquals("http://qdrant:6333", config.getQdrantBaseUrl());
        assertEquals(1024, config.getQdrantVectorSize());
        assertEquals("/srv/files", config.getStorageDir());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        RagBridgeConfig config = RagBridgeConfig.fromEnvironment(Map.of(
                "RAGBRIDGE_EMBEDDER", "openai",
                "RAGBRIDGE_HASHING_DIMENSION", "lots",
                "RAGBRIDGE_VECTOR_STORE", " ",
                "QDRANT_VECTOR_SIZE", "-5"));

        assertEquals(RagBridgeConfig.EMBEDDER_HASHING, config.getEmbedder());
        assertEquals(256, config.getHashingDimension());
        assertEquals(RagBridgeConfig.VECTOR_STORE_MEMORY, config.getVectorStore());
        assertEquals(768, config.getQdrantVectorSize());
    }

    @Test
    void builderOverridesDefaults() {
        RagBridgeConfig config = RagBridgeConfig.builder()
                .vectorStore(RagBridgeConfig.VECTOR_STORE_QDRANT)
                .storageDir(null)
                .build();

        assertEquals(RagBridgeConfig.VECTOR_STORE_QDRANT, config.getVectorStore());
        assertEquals("data/files", config.getStorageDir());
    }
}
