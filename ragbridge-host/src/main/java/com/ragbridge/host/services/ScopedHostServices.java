package com.ragbridge.host.services;

import com.ragbridge.entities.FileStreamHandle;
import com.ragbridge.host.Embedder;
import com.ragbridge.host.FileStorage;
import com.ragbridge.host.HostServices;
import com.ragbridge.host.OpenedFileStream;
import com.ragbridge.host.VectorStore;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HostServices} issued to one plugin instance: shared embedder, vector store restricted to the bound
 * collection, and file streams tracked per instance.
 */
public final class ScopedHostServices implements HostServices {

    private final Embedder embedder;
    private final CollectionScopedVectorStore vectorStore;
    private final FileStreamRegistry fileStreams;

    public ScopedHostServices(String collectionId, Embedder embedder, VectorStore vectorStore, FileStorage fileStorage) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.vectorStore = new CollectionScopedVectorStore(vectorStore, collectionId);
        this.fileStreams = new FileStreamRegistry(fileStorage);
    }

    @Override
    public Embedder getEmbedder() {
        return embedder;
    }

    @Override
    public VectorStore getVectorStore() {
        return vectorStore;
    }

    @Override
    public String getCollectionId() {
        return vectorStore.getCollectionId();
    }

    @Override
    public CompletableFuture<OpenedFileStream> getFileStream(String storagePath) {
        return fileStreams.open(storagePath);
    }

    @Override
    public CompletableFuture<Void> closeFileStream(FileStreamHandle handle) {
        return fileStreams.close(handle);
    }

    /** Streams opened through this instance and not yet closed. Zero after every completed plugin call. */
    public int getOpenFileStreamCount() {
        return fileStreams.openCount();
    }
}
