package com.ragbridge.host;

import java.util.concurrent.CompletableFuture;

/**
 * Host-side collection management, implemented by vector stores that need collections created up front.
 * Never exposed to plugins: the host creates a knowledge base's collection before the engine's create hook
 * and drops it after the delete hook.
 */
public interface CollectionAdmin {

    /** Creates the collection if it does not exist. */
    CompletableFuture<Void> createCollection(String collectionId);

    /** Drops the collection and all of its vectors; a missing collection is not an error. */
    CompletableFuture<Void> dropCollection(String collectionId);
}
