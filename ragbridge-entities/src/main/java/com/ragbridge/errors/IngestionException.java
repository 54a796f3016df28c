package com.ragbridge.errors;

/**
 * Engine-specific ingestion failure.
 */
public class IngestionException extends RagException {

    private final String documentId;

    public IngestionException(String documentId, String message) {
        this(documentId, message, null);
    }

    public IngestionException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
