package com.ragbridge.host.services;

import com.ragbridge.errors.CollectionNotFoundException;
import com.ragbridge.host.SearchHit;
import com.ragbridge.host.VectorStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * View of a shared {@link VectorStore} restricted to one collection. Calls naming any other collection fail with
 * {@link CollectionNotFoundException} without reaching the underlying store.
 */
public final class CollectionScopedVectorStore implements VectorStore {

    private final VectorStore delegate;
    private final String collectionId;

    public CollectionScopedVectorStore(VectorStore delegate, String collectionId) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.collectionId = Objects.requireNonNull(collectionId, "collectionId");
    }

    public String getCollectionId() {
        return collectionId;
    }

    @Override
    public CompletableFuture<Void> upsert(String collectionId, List<String> ids, List<float[]> vectors,
                                          List<Map<String, Object>> metadata) {
        return scoped(collectionId, () -> delegate.upsert(collectionId, ids, vectors, metadata));
    }

    @Override
    public CompletableFuture<List<SearchHit>> search(String collectionId, float[] queryVector, int topK,
                                                     Map<String, Object> filters) {
        return scoped(collectionId, () -> delegate.search(collectionId, queryVector, topK, filters));
    }

    @Override
    public CompletableFuture<Integer> delete(String collectionId, List<String> ids, Map<String, Object> filters) {
        return scoped(collectionId, () -> delegate.delete(collectionId, ids, filters));
    }

    @Override
    public CompletableFuture<Integer> count(String collectionId, Map<String, Object> filters) {
        return scoped(collectionId, () -> delegate.count(collectionId, filters));
    }

    private <T> CompletableFuture<T> scoped(String requested, Supplier<CompletableFuture<T>> call) {
        if (!collectionId.equals(requested)) {
            return CompletableFuture.failedFuture(new CollectionNotFoundException(String.valueOf(requested)));
        }
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
