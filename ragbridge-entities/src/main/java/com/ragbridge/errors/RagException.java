package com.ragbridge.errors;

/**
 * Base of every failure raised across the host/plugin boundary.
 */
public class RagException extends RuntimeException {

    public RagException(String message) {
        super(message);
    }

    public RagException(String message, Throwable cause) {
        super(message, cause);
    }
}
