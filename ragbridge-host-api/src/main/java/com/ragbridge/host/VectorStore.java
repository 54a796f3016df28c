package com.ragbridge.host;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Vector storage capability provided by the host. Ids are scoped per collection and unique within it;
 * upserting an existing id replaces it.
 * <p>
 * Failures complete the future with {@link com.ragbridge.errors.VectorStoreException} (operational, usually
 * transient) or {@link com.ragbridge.errors.CollectionNotFoundException} (the collection is not accessible).
 * Filters follow the grammar documented on {@link MetadataFilters}.
 */
public interface VectorStore {

    int DEFAULT_TOP_K = 5;

    /**
     * Inserts or replaces vectors. {@code ids}, {@code vectors} and (when non-null) {@code metadata} are parallel
     * lists; a length mismatch fails with {@link IllegalArgumentException}. The batch is all-or-nothing.
     */
    CompletableFuture<Void> upsert(String collectionId, List<String> ids, List<float[]> vectors,
                                   List<Map<String, Object>> metadata);

    default CompletableFuture<Void> upsert(String collectionId, List<String> ids, List<float[]> vectors) {
        return upsert(collectionId, ids, vectors, null);
    }

    /**
     * Returns at most {@code topK} hits ordered by descending cosine similarity. {@code filters} narrows the
     * candidates before ranking; null means no filter.
     */
    CompletableFuture<List<SearchHit>> search(String collectionId, float[] queryVector, int topK,
                                              Map<String, Object> filters);

    default CompletableFuture<List<SearchHit>> search(String collectionId, float[] queryVector) {
        return search(collectionId, queryVector, DEFAULT_TOP_K, null);
    }

    /**
     * Deletes vectors whose id is in {@code ids} or whose metadata matches {@code filters} (union when both are
     * given). An empty filter map matches every vector; passing neither fails with
     * {@link IllegalArgumentException}. Deleting a missing id is not an error.
     *
     * @return number of vectors actually removed
     */
    CompletableFuture<Integer> delete(String collectionId, List<String> ids, Map<String, Object> filters);

    /**
     * Counts vectors matching {@code filters}, or the whole collection when null.
     */
    CompletableFuture<Integer> count(String collectionId, Map<String, Object> filters);

    /**
     * Checks the parallel-list precondition of {@link #upsert}.
     *
     * @throws IllegalArgumentException on null lists or mismatched lengths
     */
    static void requireParallel(List<String> ids, List<float[]> vectors, List<Map<String, Object>> metadata) {
        if (ids == null || vectors == null) {
            throw new IllegalArgumentException("ids and vectors are required");
        }
        if (ids.size() != vectors.size()) {
            throw new IllegalArgumentException("ids and vectors differ in length: " + ids.size() + " vs " + vectors.size());
        }
        if (metadata != null && metadata.size() != ids.size()) {
            throw new IllegalArgumentException("metadata and ids differ in length: " + metadata.size() + " vs " + ids.size());
        }
    }

    /**
     * Checks the ids/filters precondition of {@link #delete}.
     *
     * @throws IllegalArgumentException when both are null
     */
    static void requireSelection(List<String> ids, Map<String, Object> filters) {
        if (ids == null && filters == null) {
            throw new IllegalArgumentException("delete requires ids or filters");
        }
    }
}
