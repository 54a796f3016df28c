package com.ragbridge.errors;

/**
 * The chunking strategy cannot be applied to the document content.
 */
public final class ChunkingException extends IngestionException {

    public ChunkingException(String documentId, String message) {
        super(documentId, message);
    }
}
