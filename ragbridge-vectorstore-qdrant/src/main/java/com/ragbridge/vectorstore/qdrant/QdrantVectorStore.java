package com.ragbridge.vectorstore.qdrant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragbridge.errors.CollectionNotFoundException;
import com.ragbridge.errors.VectorStoreException;
import com.ragbridge.host.CollectionAdmin;
import com.ragbridge.host.SearchHit;
import com.ragbridge.host.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Vector store on the Qdrant REST API (default http://localhost:6333). Collections use cosine distance, so the
 * reported score is cosine similarity.
 * <p>
 * Qdrant point ids must be integers or UUIDs: each id is mapped to a name-based UUID and the original id is kept in
 * the payload under {@value #ID_PAYLOAD_KEY}, which is stripped from returned metadata.
 */
public final class QdrantVectorStore implements VectorStore, CollectionAdmin {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStore.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:6333";
    public static final String ID_PAYLOAD_KEY = "_ragbridge_id";
    private static final int SCROLL_PAGE = 256;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final int vectorSize;
    private final HttpClient httpClient;

    public QdrantVectorStore(String baseUrl, int vectorSize) {
        if (vectorSize < 1) {
            throw new IllegalArgumentException("vectorSize must be >= 1: " + vectorSize);
        }
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.vectorSize = vectorSize;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** Qdrant point id for a store id. */
    static String pointId(String id) {
        return UUID.nameUUIDFromBytes(id.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public CompletableFuture<Void> createCollection(String collectionId) {
        Map<String, Object> body = Map.of("vectors", Map.of("size", vectorSize, "distance", "Cosine"));
        return send("PUT", collectionId, "", body, "create collection").thenApply(res -> {
            if (res.statusCode() == 200 || res.statusCode() == 201 || res.statusCode() == 409) {
                log.info("Qdrant collection {} ready (size {})", collectionId, vectorSize);
                return null;
            }
            throw failure("create collection", collectionId, res);
        });
    }

    @Override
    public CompletableFuture<Void> dropCollection(String collectionId) {
        return send("DELETE", collectionId, "", null, "drop collection").thenApply(res -> {
            if (res.statusCode() == 200 || res.statusCode() == 404) return null;
            throw failure("drop collection", collectionId, res);
        });
    }

    @Override
    public CompletableFuture<Void> upsert(String collectionId, List<String> ids, List<float[]> vectors,
                                          List<Map<String, Object>> metadata) {
        try {
            VectorStore.requireParallel(ids, vectors, metadata);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (ids.isEmpty()) return CompletableFuture.completedFuture(null);
        List<Map<String, Object>> points = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            Map<String, Object> payload = new LinkedHashMap<>();
            if (metadata != null && metadata.get(i) != null) payload.putAll(metadata.get(i));
            payload.put(ID_PAYLOAD_KEY, ids.get(i));
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("id", pointId(ids.get(i)));
            point.put("vector", vectors.get(i));
            point.put("payload", payload);
            points.add(point);
        }
        return send("PUT", collectionId, "/points?wait=true", Map.of("points", points), "upsert")
                .thenApply(res -> {
                    check("upsert", collectionId, res);
                    return null;
                });
    }

    @Override
    public CompletableFuture<List<SearchHit>> search(String collectionId, float[] queryVector, int topK,
                                                     Map<String, Object> filters) {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            if (queryVector == null) throw new IllegalArgumentException("queryVector is required");
            if (topK < 1) throw new IllegalArgumentException("topK must be >= 1: " + topK);
            body.put("vector", queryVector);
            body.put("limit", topK);
            body.put("with_payload", true);
            Map<String, Object> filter = QdrantFilters.toQdrant(filters);
            if (filter != null) body.put("filter", filter);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send("POST", collectionId, "/points/search", body, "search").thenApply(res -> {
            JsonNode result = check("search", collectionId, res).path("result");
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode point : result) {
                Map<String, Object> payload = toMap(point.path("payload"));
                Object original = payload.remove(ID_PAYLOAD_KEY);
                String id = original != null ? original.toString() : point.path("id").asText();
                hits.add(new SearchHit(id, point.path("score").asDouble(), payload));
            }
            hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
            return hits;
        });
    }

    @Override
    public CompletableFuture<Integer> delete(String collectionId, List<String> ids, Map<String, Object> filters) {
        Map<String, Object> filter;
        try {
            VectorStore.requireSelection(ids, filters);
            filter = QdrantFilters.toQdrant(filters);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Set<String>> byId = ids != null && !ids.isEmpty()
                ? existingPoints(collectionId, ids)
                : CompletableFuture.completedFuture(new LinkedHashSet<>());
        CompletableFuture<Set<String>> selected = filters != null
                ? byId.thenCompose(found -> scroll(collectionId, filter, null, found))
                : byId;
        return selected.thenCompose(pointIds -> {
            if (pointIds.isEmpty()) return CompletableFuture.completedFuture(0);
            return send("POST", collectionId, "/points/delete?wait=true",
                    Map.of("points", new ArrayList<>(pointIds)), "delete")
                    .thenApply(res -> {
                        check("delete", collectionId, res);
                        log.debug("Deleted {} point(s) from Qdrant collection {}", pointIds.size(), collectionId);
                        return pointIds.size();
                    });
        });
    }

    @Override
    public CompletableFuture<Integer> count(String collectionId, Map<String, Object> filters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("exact", true);
        try {
            Map<String, Object> filter = QdrantFilters.toQdrant(filters);
            if (filter != null) body.put("filter", filter);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send("POST", collectionId, "/points/count", body, "count")
                .thenApply(res -> check("count", collectionId, res).path("result").path("count").asInt());
    }

    private CompletableFuture<Set<String>> existingPoints(String collectionId, List<String> ids) {
        List<String> pointIds = new ArrayList<>(ids.size());
        for (String id : ids) pointIds.add(pointId(id));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", pointIds);
        body.put("with_payload", false);
        body.put("with_vector", false);
        return send("POST", collectionId, "/points", body, "retrieve points").thenApply(res -> {
            Set<String> found = new LinkedHashSet<>();
            for (JsonNode point : check("retrieve points", collectionId, res).path("result")) {
                found.add(point.path("id").asText());
            }
            return found;
        });
    }

    private CompletableFuture<Set<String>> scroll(String collectionId, Map<String, Object> filter, JsonNode offset,
                                                  Set<String> acc) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limit", SCROLL_PAGE);
        body.put("with_payload", false);
        body.put("with_vector", false);
        if (filter != null) body.put("filter", filter);
        if (offset != null) body.put("offset", MAPPER.convertValue(offset, Object.class));
        return send("POST", collectionId, "/points/scroll", body, "scroll").thenCompose(res -> {
            JsonNode result = check("scroll", collectionId, res).path("result");
            for (JsonNode point : result.path("points")) {
                acc.add(point.path("id").asText());
            }
            JsonNode next = result.path("next_page_offset");
            if (next.isMissingNode() || next.isNull()) return CompletableFuture.completedFuture(acc);
            return scroll(collectionId, filter, next, acc);
        });
    }

    private CompletableFuture<HttpResponse<String>> send(String method, String collectionId, String suffix, Object body,
                                                         String operation) {
        HttpRequest request;
        try {
            String path = collectionPath(collectionId) + suffix;
            HttpRequest.BodyPublisher publisher = body != null
                    ? HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8)
                    : HttpRequest.BodyPublishers.noBody();
            request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(60))
                    .method(method, publisher)
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new VectorStoreException("Cannot build Qdrant " + operation + " request", e));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((res, error) -> {
                    if (error != null) {
                        throw new VectorStoreException("Qdrant " + operation + " request failed: " + error.getMessage(), error);
                    }
                    return res;
                });
    }

    private static JsonNode check(String operation, String collectionId, HttpResponse<String> res) {
        if (res.statusCode() != 200) {
            throw failure(operation, collectionId, res);
        }
        try {
            return MAPPER.readTree(res.body());
        } catch (JsonProcessingException e) {
            throw new VectorStoreException("Qdrant " + operation + " returned invalid JSON", e);
        }
    }

    private static VectorStoreException failure(String operation, String collectionId, HttpResponse<String> res) {
        if (res.statusCode() == 404) {
            return new CollectionNotFoundException(collectionId, "Qdrant collection not found: " + collectionId);
        }
        return new VectorStoreException("Qdrant " + operation + " failed: " + res.statusCode() + " " + res.body());
    }

    private static String collectionPath(String collectionId) {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("collectionId must be non-blank");
        }
        return "/collections/" + URLEncoder.encode(collectionId, StandardCharsets.UTF_8);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) return new LinkedHashMap<>();
        return MAPPER.convertValue(node, LinkedHashMap.class);
    }
}
