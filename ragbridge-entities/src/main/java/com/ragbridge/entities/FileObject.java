package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to a file held by the host's storage subsystem. {@link #storagePath()} is an opaque key:
 * plugins pass it to {@code HostServices.getFileStream} and never interpret it.
 */
public record FileObject(
        @JsonProperty("file_id") String fileId,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("storage_path") String storagePath,
        @JsonProperty("mime_type") String mimeType,
        @JsonProperty("size") long size
) {
    public FileObject {
        storagePath = Objects.requireNonNull(storagePath, "storagePath").trim();
        if (storagePath.isEmpty()) {
            throw new IllegalArgumentException("storagePath must be non-blank");
        }
        fileName = fileName != null ? fileName : "";
    }

    /** Convenience for a file known only by its storage path. */
    public static FileObject of(String storagePath) {
        return new FileObject(null, fileNameOf(storagePath), storagePath, null, -1L);
    }

    private static String fileNameOf(String storagePath) {
        if (storagePath == null) return "";
        int slash = storagePath.lastIndexOf('/');
        return slash >= 0 ? storagePath.substring(slash + 1) : storagePath;
    }
}
