package com.ragbridge.host.local;

import com.ragbridge.errors.FileServiceException;
import com.ragbridge.host.FileStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File storage rooted at a local directory. Storage paths are relative to the root; paths resolving outside it
 * are rejected.
 */
public final class LocalFileStorage implements FileStorage {

    private final Path root;

    public LocalFileStorage(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public InputStream open(String storagePath) {
        Path file = resolve(storagePath);
        if (Files.isDirectory(file)) {
            throw new FileServiceException(storagePath, "Not a file: " + storagePath);
        }
        try {
            return Files.newInputStream(file);
        } catch (NoSuchFileException e) {
            throw new FileServiceException(storagePath, "File not found: " + storagePath, e);
        } catch (IOException e) {
            throw new FileServiceException(storagePath, "Cannot open " + storagePath + ": " + e.getMessage(), e);
        }
    }

    Path resolve(String storagePath) {
        if (storagePath == null || storagePath.isBlank()) {
            throw new FileServiceException(storagePath, "Storage path must be non-blank");
        }
        Path file = root.resolve(storagePath.trim()).normalize();
        if (!file.startsWith(root)) {
            throw new FileServiceException(storagePath, "Storage path escapes storage root: " + storagePath);
        }
        return file;
    }
}
