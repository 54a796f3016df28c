package com.ragbridge.host;

import java.io.InputStream;

/**
 * Host file storage transport. Resolves an opaque storage path to a readable stream.
 * Implementations decide what a storage path means (relative path, object key, ...).
 */
public interface FileStorage {

    /**
     * Opens the file for reading. The caller owns the returned stream.
     *
     * @param storagePath opaque storage key
     * @return open stream positioned at the start of the file
     * @throws com.ragbridge.errors.FileServiceException if the file cannot be opened
     */
    InputStream open(String storagePath);
}
