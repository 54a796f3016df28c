package com.ragbridge.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Host configuration loaded from environment variables.
 * <p>
 * Embedder: RAGBRIDGE_EMBEDDER ({@code hashing} or {@code ollama}), RAGBRIDGE_HASHING_DIMENSION,
 * OLLAMA_BASE_URL, OLLAMA_EMBEDDING_MODEL. Vector store: RAGBRIDGE_VECTOR_STORE ({@code memory} or
 * {@code qdrant}), QDRANT_BASE_URL, QDRANT_VECTOR_SIZE. File storage: RAGBRIDGE_STORAGE_DIR.
 * Unset, blank or unparsable values fall back to the defaults.
 */
public final class RagBridgeConfig {

    public static final String EMBEDDER_HASHING = "hashing";
    public static final String EMBEDDER_OLLAMA = "ollama";
    public static final String VECTOR_STORE_MEMORY = "memory";
    public static final String VECTOR_STORE_QDRANT = "qdrant";

    private static final String ENV_EMBEDDER = "RAGBRIDGE_EMBEDDER";
    private static final String ENV_HASHING_DIMENSION = "RAGBRIDGE_HASHING_DIMENSION";
    private static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    private static final String ENV_OLLAMA_EMBEDDING_MODEL = "OLLAMA_EMBEDDING_MODEL";
    private static final String ENV_VECTOR_STORE = "RAGBRIDGE_VECTOR_STORE";
    private static final String ENV_QDRANT_BASE_URL = "QDRANT_BASE_URL";
    private static final String ENV_QDRANT_VECTOR_SIZE = "QDRANT_VECTOR_SIZE";
    private static final String ENV_STORAGE_DIR = "RAGBRIDGE_STORAGE_DIR";

    private static final String DEFAULT_EMBEDDER = EMBEDDER_HASHING;
    private static final int DEFAULT_HASHING_DIMENSION = 256;
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_OLLAMA_EMBEDDING_MODEL = "nomic-embed-text";
    private static final String DEFAULT_VECTOR_STORE = VECTOR_STORE_MEMORY;
    private static final String DEFAULT_QDRANT_BASE_URL = "http://localhost:6333";
    /** nomic-embed-text output size. */
    private static final int DEFAULT_QDRANT_VECTOR_SIZE = 768;
    private static final String DEFAULT_STORAGE_DIR = "data/files";

    private final String embedder;
    private final int hashingDimension;
    private final String ollamaBaseUrl;
    private final String ollamaEmbeddingModel;
    private final String vectorStore;
    private final String qdrantBaseUrl;
    private final int qdrantVectorSize;
    private final String storageDir;

    private RagBridgeConfig(Builder b) {
        this.embedder = b.embedder;
        this.hashingDimension = b.hashingDimension;
        this.ollamaBaseUrl = b.ollamaBaseUrl;
        this.ollamaEmbeddingModel = b.ollamaEmbeddingModel;
        this.vectorStore = b.vectorStore;
        this.qdrantBaseUrl = b.qdrantBaseUrl;
        this.qdrantVectorSize = b.qdrantVectorSize;
        this.storageDir = b.storageDir;
    }

    /** Embedder backend: {@value #EMBEDDER_HASHING} or {@value #EMBEDDER_OLLAMA}. Default {@code hashing}. */
    public String getEmbedder() {
        return embedder;
    }

    /** Vector size of the hashing embedder. Default 256. */
    public int getHashingDimension() {
        return hashingDimension;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getOllamaEmbeddingModel() {
        return ollamaEmbeddingModel;
    }

    /** Vector store backend: {@value #VECTOR_STORE_MEMORY} or {@value #VECTOR_STORE_QDRANT}. Default {@code memory}. */
    public String getVectorStore() {
        return vectorStore;
    }

    public String getQdrantBaseUrl() {
        return qdrantBaseUrl;
    }

    /** Vector size used when creating Qdrant collections. Must match the embedder's output. Default 768. */
    public int getQdrantVectorSize() {
        return qdrantVectorSize;
    }

    /** Root directory that storage paths handed to components resolve against. Default {@code data/files}. */
    public String getStorageDir() {
        return storageDir;
    }

    public static RagBridgeConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    public static RagBridgeConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return fromEnvironment(env::get);
    }

    private static RagBridgeConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .embedder(parseChoice(env.apply(ENV_EMBEDDER), DEFAULT_EMBEDDER, EMBEDDER_HASHING, EMBEDDER_OLLAMA))
                .hashingDimension(parsePositiveInt(env.apply(ENV_HASHING_DIMENSION), DEFAULT_HASHING_DIMENSION))
                .ollamaBaseUrl(getEnv(env, ENV_OLLAMA_BASE_URL, DEFAULT_OLLAMA_BASE_URL))
                .ollamaEmbeddingModel(getEnv(env, ENV_OLLAMA_EMBEDDING_MODEL, DEFAULT_OLLAMA_EMBEDDING_MODEL))
                .vectorStore(parseChoice(env.apply(ENV_VECTOR_STORE), DEFAULT_VECTOR_STORE,
                        VECTOR_STORE_MEMORY, VECTOR_STORE_QDRANT))
                .qdrantBaseUrl(getEnv(env, ENV_QDRANT_BASE_URL, DEFAULT_QDRANT_BASE_URL))
                .qdrantVectorSize(parsePositiveInt(env.apply(ENV_QDRANT_VECTOR_SIZE), DEFAULT_QDRANT_VECTOR_SIZE))
                .storageDir(getEnv(env, ENV_STORAGE_DIR, DEFAULT_STORAGE_DIR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String parseChoice(String value, String defaultValue, String... allowed) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (String a : allowed) {
            if (a.equals(v)) return a;
        }
        return defaultValue;
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "RagBridgeConfig{embedder=" + embedder
                + ", vectorStore=" + vectorStore
                + ", storageDir=" + storageDir + '}';
    }

    public static final class Builder {
        private String embedder = DEFAULT_EMBEDDER;
        private int hashingDimension = DEFAULT_HASHING_DIMENSION;
        private String ollamaBaseUrl = DEFAULT_OLLAMA_BASE_URL;
        private String ollamaEmbeddingModel = DEFAULT_OLLAMA_EMBEDDING_MODEL;
        private String vectorStore = DEFAULT_VECTOR_STORE;
        private String qdrantBaseUrl = DEFAULT_QDRANT_BASE_URL;
        private int qdrantVectorSize = DEFAULT_QDRANT_VECTOR_SIZE;
        private String storageDir = DEFAULT_STORAGE_DIR;

        public Builder embedder(String embedder) {
            this.embedder = embedder != null ? embedder : DEFAULT_EMBEDDER;
            return this;
        }

        public Builder hashingDimension(int hashingDimension) {
            this.hashingDimension = hashingDimension;
            return this;
        }

        public Builder ollamaBaseUrl(String ollamaBaseUrl) {
            this.ollamaBaseUrl = ollamaBaseUrl != null ? ollamaBaseUrl : DEFAULT_OLLAMA_BASE_URL;
            return this;
        }

        public Builder ollamaEmbeddingModel(String ollamaEmbeddingModel) {
            this.ollamaEmbeddingModel = ollamaEmbeddingModel != null ? ollamaEmbeddingModel : DEFAULT_OLLAMA_EMBEDDING_MODEL;
            return this;
        }

        public Builder vectorStore(String vectorStore) {
            this.vectorStore = vectorStore != null ? vectorStore : DEFAULT_VECTOR_STORE;
            return this;
        }

        public Builder qdrantBaseUrl(String qdrantBaseUrl) {
            this.qdrantBaseUrl = qdrantBaseUrl != null ? qdrantBaseUrl : DEFAULT_QDRANT_BASE_URL;
            return this;
        }

        public Builder qdrantVectorSize(int qdrantVectorSize) {
            this.qdrantVectorSize = qdrantVectorSize;
            return this;
        }

        public Builder storageDir(String storageDir) {
            this.storageDir = storageDir != null ? storageDir : DEFAULT_STORAGE_DIR;
            return this;
        }

        public RagBridgeConfig build() {
            return new RagBridgeConfig(this);
        }
    }
}
