package com.ragbridge.errors;

/**
 * The embedder could not embed a batch or query. Batches fail as a whole; there is no partial result.
 */
public final class EmbeddingException extends HostCapabilityException {

    public EmbeddingException(String message) {
        this(message, null);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
