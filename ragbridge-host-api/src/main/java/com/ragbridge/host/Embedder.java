package com.ragbridge.host;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding capability provided by the host. Plugins reach it only through {@link HostServices#getEmbedder()}.
 * <p>
 * Failures complete the future with {@link com.ragbridge.errors.EmbeddingException}. A batch is atomic: either
 * every text is embedded or the whole call fails.
 */
public interface Embedder {

    /**
     * Embeds a batch of texts. Element {@code i} of the result is the vector for element {@code i} of the input;
     * the result always has the same size as {@code texts}.
     *
     * @param texts texts to embed; empty list yields an empty result
     * @return future of one vector per input text, in input order
     */
    CompletableFuture<List<float[]>> embedDocuments(List<String> texts);

    /**
     * Embeds a single query text.
     *
     * @param text query text
     * @return future of the query vector
     */
    CompletableFuture<float[]> embedQuery(String text);
}
