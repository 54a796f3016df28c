package com.ragbridge.errors;

/**
 * A file stream could not be opened, read or released by the host.
 */
public final class FileServiceException extends HostCapabilityException {

    private final String storagePath;

    public FileServiceException(String storagePath, String message) {
        this(storagePath, message, null);
    }

    public FileServiceException(String storagePath, String message, Throwable cause) {
        super(message, cause, true);
        this.storagePath = storagePath;
    }

    public String getStoragePath() {
        return storagePath;
    }
}
