package com.ragbridge.errors;

/**
 * Engine-specific retrieval failure.
 */
public final class RetrievalException extends RagException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
