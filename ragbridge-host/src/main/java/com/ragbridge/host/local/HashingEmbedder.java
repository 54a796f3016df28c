package com.ragbridge.host.local;

import com.ragbridge.errors.EmbeddingException;
import com.ragbridge.host.Embedder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.zip.CRC32;

/**
 * Deterministic offline embedder: lower-cased word tokens are hashed into a fixed number of signed buckets and the
 * result is L2-normalized. Texts sharing words get positive cosine similarity; no model is needed.
 */
public final class HashingEmbedder implements Embedder {

    public static final int DEFAULT_DIMENSION = 256;

    private final int dimension;

    public HashingEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1: " + dimension);
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    @Override
    public CompletableFuture<List<float[]>> embedDocuments(List<String> texts) {
        if (texts == null) {
            return CompletableFuture.failedFuture(new EmbeddingException("texts is null"));
        }
        List<float[]> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null) {
                return CompletableFuture.failedFuture(new EmbeddingException("Text at index " + i + " is null"));
            }
            out.add(embed(text));
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public CompletableFuture<float[]> embedQuery(String text) {
        if (text == null) {
            return CompletableFuture.failedFuture(new EmbeddingException("Query text is null"));
        }
        return CompletableFuture.completedFuture(embed(text));
    }

    float[] embed(String text) {
        float[] v = new float[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) continue;
            long h = hash(token);
            int bucket = (int) Math.floorMod(h, (long) dimension);
            v[bucket] += ((h >>> 32) & 1L) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float x : v) norm += (double) x * x;
        if (norm > 0) {
            float inv = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < v.length; i++) v[i] *= inv;
        }
        return v;
    }

    private static long hash(String token) {
        CRC32 crc = new CRC32();
        byte[] bytes = token.getBytes(StandardCharsets.UTF_8);
        crc.update(bytes);
        long low = crc.getValue();
        crc.update(bytes);
        return (crc.getValue() << 32) | low;
    }
}
