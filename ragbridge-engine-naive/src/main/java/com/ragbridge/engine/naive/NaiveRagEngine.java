package com.ragbridge.engine.naive;

import com.ragbridge.entities.IngestionContext;
import com.ragbridge.entities.IngestionResult;
import com.ragbridge.entities.RetrievalContext;
import com.ragbridge.entities.RetrievalResponse;
import com.ragbridge.entities.RetrievalResultEntry;
import com.ragbridge.entities.Settings;
import com.ragbridge.errors.HostErrors;
import com.ragbridge.errors.IngestionException;
import com.ragbridge.errors.ParsingException;
import com.ragbridge.errors.RetrievalException;
import com.ragbridge.host.HostServices;
import com.ragbridge.host.SearchHit;
import com.ragbridge.host.VectorStore;
import com.ragbridge.plugin.RagEngine;
import com.ragbridge.schema.SettingsSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference {@link RagEngine}: UTF-8 text documents, character-window or paragraph chunking, dense retrieval with an
 * optional lexical rerank.
 * <p>
 * Chunk ids are {@code documentId#index}. Every chunk carries {@code document_id}, {@code chunk_index},
 * {@code text}, {@code file_name} and {@code knowledge_base_id} metadata. A failed ingestion removes every chunk it
 * wrote for the document before failing.
 */
public final class NaiveRagEngine implements RagEngine {

    private static final Logger log = LoggerFactory.getLogger(NaiveRagEngine.class);

    public static final String COMPONENT_ID = "naive-rag";

    public static final String INDEX_MODE = "index_mode";
    public static final String CHUNK_SIZE = "chunk_size";
    public static final String CHUNK_OVERLAP = "chunk_overlap";
    public static final String TOP_K = "top_k";
    public static final String SIMILARITY_THRESHOLD = "similarity_threshold";
    public static final String ENABLE_RERANK = "enable_rerank";

    public static final String META_DOCUMENT_ID = "document_id";
    public static final String META_CHUNK_INDEX = "chunk_index";
    public static final String META_TEXT = "text";
    public static final String META_FILE_NAME = "file_name";
    public static final String META_KNOWLEDGE_BASE_ID = "knowledge_base_id";

    static final int EMBED_BATCH = 32;
    private static final int RERANK_POOL_FACTOR = 3;
    private static final double RERANK_LEXICAL_WEIGHT = 0.3;

    static final SettingsSchema CREATION_SCHEMA = SettingsSchema.builder()
            .title("Naive RAG knowledge base settings")
            .stringEnum(INDEX_MODE, "Index mode", List.of(TextChunker.MODE_GENERAL, TextChunker.MODE_PARAGRAPH),
                    TextChunker.MODE_GENERAL)
            .describe(INDEX_MODE, "general: fixed-size windows; paragraph: pack whole paragraphs")
            .integer(CHUNK_SIZE, "Chunk size (characters)", 100, 2000, 512)
            .integer(CHUNK_OVERLAP, "Chunk overlap (characters)", 0, 500, 0)
            .required(INDEX_MODE)
            .build();

    static final SettingsSchema RETRIEVAL_SCHEMA = SettingsSchema.builder()
            .title("Naive RAG retrieval settings")
            .integer(TOP_K, "Top K", 1, 100, VectorStore.DEFAULT_TOP_K)
            .number(SIMILARITY_THRESHOLD, "Similarity threshold", 0.0, 1.0, 0.0)
            .bool(ENABLE_RERANK, "Enable rerank", false)
            .build();

    private final HostServices hostServices;
    private final Map<String, Map<String, Object>> knowledgeBaseSettings = new ConcurrentHashMap<>();
    private final Map<String, Integer> documentChunks = new ConcurrentHashMap<>();

    public NaiveRagEngine(HostServices hostServices) {
        this.hostServices = Objects.requireNonNull(hostServices, "hostServices");
    }

    @Override
    public CompletableFuture<Void> onKnowledgeBaseCreate(String knowledgeBaseId, Map<String, Object> config) {
        knowledgeBaseSettings.put(knowledgeBaseId, Settings.copyOf(config));
        log.info("Knowledge base {} bound to collection {} with {}", knowledgeBaseId, hostServices.getCollectionId(), config);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> onKnowledgeBaseDelete(String knowledgeBaseId) {
        knowledgeBaseSettings.remove(knowledgeBaseId);
        documentChunks.clear();
        log.info("Knowledge base {} released", knowledgeBaseId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<IngestionResult> ingest(IngestionContext context) {
        String documentId = context.documentId();
        Map<String, Object> settings = Settings.merge(
                knowledgeBaseSettings.getOrDefault(String.valueOf(context.knowledgeBaseId()), Map.of()),
                context.effectiveChunkingSettings());
        String mode = String.valueOf(settings.getOrDefault(INDEX_MODE, TextChunker.MODE_GENERAL));
        int chunkSize = Settings.intValue(settings.get(CHUNK_SIZE), 512);
        int chunkOverlap = Settings.intValue(settings.get(CHUNK_OVERLAP), 0);
        long started = System.nanoTime();

        return hostServices.withFileStream(context.fileObject().storagePath(),
                        in -> CompletableFuture.completedFuture(decode(documentId, in)))
                .exceptionally(error -> {
                    throw HostErrors.asCompletion(HostErrors.toPluginFailure("read " + context.fileObject().storagePath(), error));
                })
                .thenCompose(text -> {
                    List<String> chunks = new TextChunker(mode, chunkSize, chunkOverlap).chunk(documentId, text);
                    List<Map<String, Object>> metadata = new ArrayList<>(chunks.size());
                    List<String> ids = new ArrayList<>(chunks.size());
                    for (int i = 0; i < chunks.size(); i++) {
                        ids.add(chunkId(documentId, i));
                        Map<String, Object> md = new LinkedHashMap<>();
                        md.put(META_DOCUMENT_ID, documentId);
                        md.put(META_CHUNK_INDEX, i);
                        md.put(META_TEXT, chunks.get(i));
                        md.put(META_FILE_NAME, context.fileObject().fileName());
                        md.put(META_KNOWLEDGE_BASE_ID, context.knowledgeBaseId());
                        metadata.add(md);
                    }
                    return store(documentId, chunks, ids, metadata);
                })
                .thenApply(count -> {
                    Integer previous = documentChunks.put(documentId, count);
                    Map<String, Object> md = new LinkedHashMap<>();
                    md.put(INDEX_MODE, mode);
                    md.put(CHUNK_SIZE, chunkSize);
                    md.put(CHUNK_OVERLAP, chunkOverlap);
                    md.put("took_ms", (System.nanoTime() - started) / 1_000_000L);
                    if (previous != null) md.put("previous_chunk_count", previous);
                    log.info("Ingested document {} into {} as {} chunk(s)", documentId, hostServices.getCollectionId(), count);
                    return IngestionResult.completed(documentId, count, md);
                });
    }

    /**
     * Embeds and upserts in batches, then removes chunks left over from an earlier, longer version of the document.
     * On failure after any batch was written, every chunk of the document is removed before the failure propagates.
     */
    private CompletableFuture<Integer> store(String documentId, List<String> chunks, List<String> ids,
                                             List<Map<String, Object>> metadata) {
        VectorStore store = hostServices.getVectorStore();
        String collection = hostServices.getCollectionId();
        boolean[] written = {false};
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int from = 0; from < chunks.size(); from += EMBED_BATCH) {
            int start = from;
            int end = Math.min(chunks.size(), from + EMBED_BATCH);
            chain = chain
                    .thenCompose(ignored -> hostServices.getEmbedder().embedDocuments(chunks.subList(start, end)))
                    .thenCompose(vectors -> {
                        if (vectors.size() != end - start) {
                            throw new IngestionException(documentId,
                                    "Embedder returned " + vectors.size() + " vector(s) for " + (end - start) + " chunk(s)");
                        }
                        return store.upsert(collection, ids.subList(start, end), vectors, metadata.subList(start, end));
                    })
                    .thenRun(() -> written[0] = true);
        }
        return chain
                .thenCompose(ignored -> store.delete(collection, null, Map.of(
                        META_DOCUMENT_ID, documentId,
                        META_CHUNK_INDEX, Map.of("$gte", chunks.size()))))
                .thenApply(stale -> {
                    if (stale > 0) log.debug("Removed {} stale chunk(s) of document {}", stale, documentId);
                    return chunks.size();
                })
                .<CompletableFuture<Integer>>handle((count, error) -> {
                    if (error == null) return CompletableFuture.completedFuture(count);
                    Throwable failure = HostErrors.toPluginFailure("store chunks of " + documentId, error);
                    if (!written[0]) return CompletableFuture.<Integer>failedFuture(failure);
                    log.warn("Ingestion of {} failed; rolling back its chunks: {}", documentId, failure.getMessage());
                    documentChunks.remove(documentId);
                    return store.delete(collection, null, Map.of(META_DOCUMENT_ID, documentId))
                            .<Integer>handle((removed, rollbackError) -> {
                                if (rollbackError != null) failure.addSuppressed(HostErrors.unwrap(rollbackError));
                                throw HostErrors.asCompletion(failure);
                            });
                })
                .thenCompose(f -> f);
    }

    @Override
    public CompletableFuture<Boolean> deleteDocument(String knowledgeBaseId, String documentId) {
        VectorStore store = hostServices.getVectorStore();
        String collection = hostServices.getCollectionId();
        Map<String, Object> filter = Map.of(META_DOCUMENT_ID, documentId);
        return store.count(collection, filter)
                .thenCompose(existing -> {
                    if (existing == 0) return CompletableFuture.completedFuture(false);
                    return store.delete(collection, null, filter).thenApply(removed -> {
                        log.info("Deleted {} chunk(s) of document {} from {}", removed, documentId, collection);
                        return true;
                    });
                })
                .whenComplete((deleted, error) -> {
                    if (error == null) documentChunks.remove(documentId);
                })
                .exceptionally(error -> {
                    throw HostErrors.asCompletion(HostErrors.toPluginFailure("delete document " + documentId, error));
                });
    }

    @Override
    public CompletableFuture<RetrievalResponse> retrieve(RetrievalContext context) {
        String query = context.query().strip().replaceAll("\\s+", " ");
        if (query.isEmpty()) {
            return CompletableFuture.failedFuture(new RetrievalException("Query must not be blank"));
        }
        int topK = Math.max(1, context.getInt(TOP_K, VectorStore.DEFAULT_TOP_K));
        double threshold = context.getDouble(SIMILARITY_THRESHOLD, 0.0);
        boolean rerank = context.getBoolean(ENABLE_RERANK, false);
        int pool = rerank ? Math.min(topK * RERANK_POOL_FACTOR, 100) : topK;
        long started = System.nanoTime();
        VectorStore store = hostServices.getVectorStore();

        return hostServices.getEmbedder().embedQuery(query)
                .thenCompose(vector -> store.search(hostServices.getCollectionId(), vector, pool, null))
                .exceptionally(error -> {
                    throw HostErrors.asCompletion(HostErrors.toPluginFailure("search " + hostServices.getCollectionId(), error));
                })
                .thenApply(hits -> {
                    List<Scored> scored = new ArrayList<>();
                    for (SearchHit hit : hits) {
                        if (hit.score() >= threshold) scored.add(new Scored(hit, hit.score()));
                    }
                    if (rerank) {
                        Set<String> queryTerms = terms(query);
                        for (Scored s : scored) {
                            double lexical = overlap(queryTerms, String.valueOf(s.hit.metadata().getOrDefault(META_TEXT, "")));
                            s.score = (1 - RERANK_LEXICAL_WEIGHT) * s.hit.score() + RERANK_LEXICAL_WEIGHT * lexical;
                        }
                        scored.sort(Comparator.comparingDouble((Scored s) -> s.score).reversed());
                    }
                    List<RetrievalResultEntry> entries = new ArrayList<>();
                    for (Scored s : scored) {
                        if (entries.size() == topK) break;
                        entries.add(new RetrievalResultEntry(s.hit.id(), s.hit.metadata(), 1.0 - s.score));
                    }
                    Map<String, Object> md = new LinkedHashMap<>();
                    md.put("took_ms", (System.nanoTime() - started) / 1_000_000L);
                    md.put("rerank_applied", rerank);
                    md.put("candidates", hits.size());
                    return new RetrievalResponse(entries, md);
                });
    }

    @Override
    public SettingsSchema getCreationSettingsSchema() {
        return CREATION_SCHEMA;
    }

    @Override
    public SettingsSchema getRetrievalSettingsSchema() {
        return RETRIEVAL_SCHEMA;
    }

    static String chunkId(String documentId, int index) {
        return documentId + "#" + index;
    }

    static String decode(String documentId, InputStream in) {
        byte[] bytes;
        try {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new IngestionException(documentId, "Cannot read document " + documentId + ": " + e.getMessage(), e);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ParsingException(documentId, "Document " + documentId + " is not valid UTF-8 text", e);
        }
        if (text.isBlank()) {
            throw new ParsingException(documentId, "Document " + documentId + " is empty");
        }
        return text;
    }

    static Set<String> terms(String text) {
        Set<String> out = new HashSet<>();
        for (String t : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    static double overlap(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty()) return 0.0;
        Set<String> chunkTerms = terms(text);
        int hits = 0;
        for (String t : queryTerms) {
            if (chunkTerms.contains(t)) hits++;
        }
        return (double) hits / queryTerms.size();
    }

    private static final class Scored {
        private final SearchHit hit;
        private double score;

        Scored(SearchHit hit, double score) {
            this.hit = hit;
            this.score = score;
        }
    }
}
