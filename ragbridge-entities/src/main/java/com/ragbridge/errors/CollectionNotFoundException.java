package com.ragbridge.errors;

/**
 * The bound collection is missing or not accessible to the caller. Not retryable without host-side
 * reconfiguration.
 */
public final class CollectionNotFoundException extends VectorStoreException {

    private final String collectionId;

    public CollectionNotFoundException(String collectionId) {
        this(collectionId, "Collection not accessible: " + collectionId);
    }

    public CollectionNotFoundException(String collectionId, String message) {
        super(message, null, false);
        this.collectionId = collectionId;
    }

    public String getCollectionId() {
        return collectionId;
    }
}
