package com.ragbridge.errors;

/**
 * Operational (typically transient) vector store failure.
 */
public class VectorStoreException extends HostCapabilityException {

    public VectorStoreException(String message) {
        this(message, null);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause, true);
    }

    protected VectorStoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}
