/**
 * Capabilities the host provides to RAG plugins, reachable only through {@link com.ragbridge.host.HostServices}.
 * <ul>
 *   <li>{@link com.ragbridge.host.Embedder} – batch and query embedding</li>
 *   <li>{@link com.ragbridge.host.VectorStore} – upsert/search/delete/count; scores are cosine similarity, higher first</li>
 *   <li>{@link com.ragbridge.host.MetadataFilters} – filter grammar for search, delete and count</li>
 *   <li>{@link com.ragbridge.host.FileStorage} – host storage transport behind file streams</li>
 *   <li>{@link com.ragbridge.host.CollectionAdmin} – host-only collection creation and removal</li>
 * </ul>
 * All plugin-facing calls return {@link java.util.concurrent.CompletableFuture}; failures arrive as exceptional
 * completion with the types in {@code com.ragbridge.errors}.
 */
package com.ragbridge.host;
