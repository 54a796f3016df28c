package com.ragbridge.host;

import com.ragbridge.entities.FileStreamHandle;

import java.io.InputStream;
import java.util.Objects;

/**
 * A readable stream plus the handle that releases it. The stream must not be used after
 * {@link HostServices#closeFileStream} is called with the handle.
 */
public record OpenedFileStream(InputStream stream, FileStreamHandle handle) {

    public OpenedFileStream {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(handle, "handle");
    }
}
