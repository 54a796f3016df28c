package com.ragbridge.embedding.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragbridge.errors.EmbeddingException;
import com.ragbridge.host.Embedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embedder that calls Ollama {@code POST /api/embed} with the whole batch as {@code input}.
 * A non-200 status, an unparsable body or a vector count different from the input size fails the whole batch
 * with {@link EmbeddingException}.
 */
public final class OllamaEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbedder.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "nomic-embed-text";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;

    public OllamaEmbedder(String baseUrl, String model) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = model != null && !model.isBlank() ? model.trim() : DEFAULT_MODEL;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public OllamaEmbedder() {
        this(DEFAULT_BASE_URL, DEFAULT_MODEL);
    }

    public String getModel() {
        return model;
    }

    @Override
    public CompletableFuture<List<float[]>> embedDocuments(List<String> texts) {
        if (texts == null) {
            return CompletableFuture.failedFuture(new EmbeddingException("texts is null"));
        }
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        for (int i = 0; i < texts.size(); i++) {
            if (texts.get(i) == null) {
                return CompletableFuture.failedFuture(new EmbeddingException("Text at index " + i + " is null"));
            }
        }
        HttpRequest request;
        try {
            Map<String, Object> reqBody = new LinkedHashMap<>();
            reqBody.put("model", model);
            reqBody.put("input", texts);
            request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/embed"))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(60))
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(reqBody), StandardCharsets.UTF_8))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new EmbeddingException("Cannot build Ollama embed request", e));
        }
        log.debug("Embedding {} text(s) with Ollama model {}", texts.size(), model);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        throw new EmbeddingException("Ollama embed request failed: " + error.getMessage(), error);
                    }
                    return parse(response, texts.size());
                });
    }

    @Override
    public CompletableFuture<float[]> embedQuery(String text) {
        if (text == null) {
            return CompletableFuture.failedFuture(new EmbeddingException("Query text is null"));
        }
        return embedDocuments(List.of(text)).thenApply(vectors -> vectors.get(0));
    }

    private List<float[]> parse(HttpResponse<String> response, int expected) {
        if (response.statusCode() != 200) {
            throw new EmbeddingException("Ollama embed API error: " + response.statusCode() + " " + response.body());
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Ollama embed API returned invalid JSON", e);
        }
        List<float[]> embeddings = new ArrayList<>();
        JsonNode embNode = root.path("embeddings");
        if (embNode.isArray()) {
            for (JsonNode arr : embNode) {
                if (!arr.isArray()) {
                    throw new EmbeddingException("Ollama embed API returned a non-array embedding");
                }
                float[] vec = new float[arr.size()];
                for (int i = 0; i < arr.size(); i++) vec[i] = (float) arr.get(i).asDouble(0);
                embeddings.add(vec);
            }
        }
        if (embeddings.size() != expected) {
            throw new EmbeddingException("Ollama returned " + embeddings.size() + " embedding(s) for " + expected + " text(s)");
        }
        return embeddings;
    }
}
