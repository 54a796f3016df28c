package com.ragbridge.host.local;

import com.ragbridge.errors.CollectionNotFoundException;
import com.ragbridge.host.CollectionAdmin;
import com.ragbridge.host.MetadataFilters;
import com.ragbridge.host.SearchHit;
import com.ragbridge.host.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process vector store. Ranks by cosine similarity with a linear scan; intended for local runs,
 * tests and small knowledge bases.
 */
public final class InMemoryVectorStore implements VectorStore, CollectionAdmin {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final Map<String, Collection> collections = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> createCollection(String collectionId) {
        if (collectionId == null || collectionId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("collectionId must be non-blank"));
        }
        if (collections.putIfAbsent(collectionId, new Collection()) == null) {
            log.debug("Created collection {}", collectionId);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> dropCollection(String collectionId) {
        if (collectionId != null && collections.remove(collectionId) != null) {
            log.debug("Dropped collection {}", collectionId);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> upsert(String collectionId, List<String> ids, List<float[]> vectors,
                                          List<Map<String, Object>> metadata) {
        try {
            VectorStore.requireParallel(ids, vectors, metadata);
            Collection c = require(collectionId);
            synchronized (c) {
                int dimension = c.points.isEmpty() && !vectors.isEmpty() && vectors.get(0) != null
                        ? vectors.get(0).length : c.dimension;
                for (float[] vector : vectors) {
                    c.checkDimension(vector, dimension);
                }
                if (!vectors.isEmpty()) c.dimension = dimension;
                for (int i = 0; i < ids.size(); i++) {
                    Map<String, Object> md = metadata != null && metadata.get(i) != null ? metadata.get(i) : Map.of();
                    c.points.put(ids.get(i), new Point(vectors.get(i).clone(), new LinkedHashMap<>(md)));
                }
            }
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<List<SearchHit>> search(String collectionId, float[] queryVector, int topK,
                                                     Map<String, Object> filters) {
        try {
            if (queryVector == null) throw new IllegalArgumentException("queryVector is required");
            if (topK < 1) throw new IllegalArgumentException("topK must be >= 1: " + topK);
            MetadataFilters.validate(filters);
            Collection c = require(collectionId);
            List<SearchHit> hits = new ArrayList<>();
            synchronized (c) {
                if (!c.points.isEmpty()) c.checkDimension(queryVector, c.dimension);
                for (Map.Entry<String, Point> e : c.points.entrySet()) {
                    Point p = e.getValue();
                    if (!MetadataFilters.matches(filters, p.metadata)) continue;
                    hits.add(new SearchHit(e.getKey(), cosine(queryVector, p.vector), p.metadata));
                }
            }
            hits.sort(Comparator.comparingDouble(SearchHit::score).reversed().thenComparing(SearchHit::id));
            return CompletableFuture.completedFuture(hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Integer> delete(String collectionId, List<String> ids, Map<String, Object> filters) {
        try {
            VectorStore.requireSelection(ids, filters);
            MetadataFilters.validate(filters);
            Collection c = require(collectionId);
            synchronized (c) {
                Set<String> doomed = new HashSet<>();
                if (ids != null) {
                    for (String id : ids) {
                        if (c.points.containsKey(id)) doomed.add(id);
                    }
                }
                if (filters != null) {
                    for (Map.Entry<String, Point> e : c.points.entrySet()) {
                        if (MetadataFilters.matches(filters, e.getValue().metadata)) doomed.add(e.getKey());
                    }
                }
                c.points.keySet().removeAll(doomed);
                return CompletableFuture.completedFuture(doomed.size());
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Integer> count(String collectionId, Map<String, Object> filters) {
        try {
            MetadataFilters.validate(filters);
            Collection c = require(collectionId);
            synchronized (c) {
                if (filters == null || filters.isEmpty()) {
                    return CompletableFuture.completedFuture(c.points.size());
                }
                int n = 0;
                for (Point p : c.points.values()) {
                    if (MetadataFilters.matches(filters, p.metadata)) n++;
                }
                return CompletableFuture.completedFuture(n);
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Whether the collection exists. */
    public boolean hasCollection(String collectionId) {
        return collectionId != null && collections.containsKey(collectionId);
    }

    private Collection require(String collectionId) {
        Collection c = collectionId != null ? collections.get(collectionId) : null;
        if (c == null) {
            throw new CollectionNotFoundException(String.valueOf(collectionId));
        }
        return c;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    private static final class Collection {
        private final Map<String, Point> points = new LinkedHashMap<>();
        private int dimension = -1;

        void checkDimension(float[] vector, int expected) {
            if (vector == null) throw new IllegalArgumentException("vector is required");
            if (vector.length != expected) {
                throw new IllegalArgumentException("Vector dimension " + vector.length + " does not match collection dimension " + expected);
            }
        }
    }

    private static final class Point {
        private final float[] vector;
        private final Map<String, Object> metadata;

        Point(float[] vector, Map<String, Object> metadata) {
            this.vector = vector;
            this.metadata = metadata;
        }
    }
}
