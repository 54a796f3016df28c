package com.ragbridge.errors;

/**
 * Document content is unreadable or malformed.
 */
public final class ParsingException extends IngestionException {

    public ParsingException(String documentId, String message) {
        super(documentId, message);
    }

    public ParsingException(String documentId, String message, Throwable cause) {
        super(documentId, message, cause);
    }
}
