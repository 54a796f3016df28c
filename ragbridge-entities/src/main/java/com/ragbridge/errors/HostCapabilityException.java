package com.ragbridge.errors;

/**
 * Failure originating below {@code HostServices} (embedding, vector storage, file storage).
 * Plugins may re-surface it as {@link HostServiceException} but must not swallow it.
 */
public abstract class HostCapabilityException extends RagException {

    private final boolean retryable;

    protected HostCapabilityException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /** Whether the host may retry the failed call without reconfiguration. */
    public boolean isRetryable() {
        return retryable;
    }
}
