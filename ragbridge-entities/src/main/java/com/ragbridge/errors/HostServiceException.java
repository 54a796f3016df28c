package com.ragbridge.errors;

/**
 * Raised by a plugin when a host capability it called failed. The original failure is kept as the cause
 * so the host can tell "infrastructure failed" apart from plugin logic errors.
 */
public final class HostServiceException extends RagException {

    private final HostCapabilityException hostCause;

    public HostServiceException(String message, HostCapabilityException hostCause) {
        super(message + ": " + hostCause.getMessage(), hostCause);
        this.hostCause = hostCause;
    }

    public HostCapabilityException getHostCause() {
        return hostCause;
    }

    public boolean isRetryable() {
        return hostCause.isRetryable();
    }
}
