package com.ragbridge.entities;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque token returned with a file stream. Pass it back to {@code closeFileStream} exactly once.
 */
public record FileStreamHandle(String handleId, String storagePath) {

    public FileStreamHandle {
        Objects.requireNonNull(handleId, "handleId");
        Objects.requireNonNull(storagePath, "storagePath");
    }

    public static FileStreamHandle newHandle(String storagePath) {
        return new FileStreamHandle(UUID.randomUUID().toString(), storagePath);
    }
}
