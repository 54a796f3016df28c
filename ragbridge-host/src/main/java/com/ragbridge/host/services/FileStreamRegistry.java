package com.ragbridge.host.services;

import com.ragbridge.entities.FileStreamHandle;
import com.ragbridge.errors.FileServiceException;
import com.ragbridge.host.FileStorage;
import com.ragbridge.host.OpenedFileStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks streams handed out to one plugin instance so each handle is released exactly once.
 * A second release of the same handle, or a handle this registry never issued, fails with
 * {@link FileServiceException}.
 */
public final class FileStreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(FileStreamRegistry.class);

    private final FileStorage storage;
    private final Map<String, InputStream> open = new ConcurrentHashMap<>();

    public FileStreamRegistry(FileStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    public CompletableFuture<OpenedFileStream> open(String storagePath) {
        if (storagePath == null || storagePath.isBlank()) {
            return CompletableFuture.failedFuture(new FileServiceException(storagePath, "Storage path must be non-blank"));
        }
        InputStream stream;
        try {
            stream = storage.open(storagePath);
        } catch (FileServiceException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new FileServiceException(storagePath, "Cannot open " + storagePath + ": " + e.getMessage(), e));
        }
        FileStreamHandle handle = FileStreamHandle.newHandle(storagePath);
        open.put(handle.handleId(), stream);
        log.debug("Opened file stream {} for {}", handle.handleId(), storagePath);
        return CompletableFuture.completedFuture(new OpenedFileStream(stream, handle));
    }

    public CompletableFuture<Void> close(FileStreamHandle handle) {
        if (handle == null) {
            return CompletableFuture.failedFuture(new FileServiceException(null, "File stream handle is null"));
        }
        InputStream stream = open.remove(handle.handleId());
        if (stream == null) {
            return CompletableFuture.failedFuture(new FileServiceException(handle.storagePath(),
                    "Unknown or already closed file stream handle: " + handle.handleId()));
        }
        try {
            stream.close();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new FileServiceException(handle.storagePath(),
                    "Failed to close file stream for " + handle.storagePath(), e));
        }
        log.debug("Closed file stream {} for {}", handle.handleId(), handle.storagePath());
        return CompletableFuture.completedFuture(null);
    }

    /** Number of handles issued and not yet released. */
    public int openCount() {
        return open.size();
    }
}
