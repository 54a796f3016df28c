package com.ragbridge.host.services;

import com.ragbridge.entities.FileStreamHandle;
import com.ragbridge.errors.CollectionNotFoundException;
import com.ragbridge.errors.FileServiceException;
import com.ragbridge.host.OpenedFileStream;
import com.ragbridge.host.local.HashingEmbedder;
import com.ragbridge.host.local.InMemoryVectorStore;
import com.ragbridge.host.local.LocalFileStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScopedHostServicesTest {

    @TempDir
    Path root;

    private InMemoryVectorStore store;
    private ScopedHostServices services;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(root.resolve("doc.txt"), "some text", StandardCharsets.UTF_8);
        store = new InMemoryVectorStore();
        store.createCollection("kb-a").join();
        store.createCollection("kb-b").join();
        services = new ScopedHostServices("kb-a", new HashingEmbedder(8), store, new LocalFileStorage(root));
    }

    @Test
    void vectorStore_acceptsOwnCollection() {
        services.getVectorStore().upsert("kb-a", List.of("x"), List.of(new float[8])).join();

        assertEquals("kb-a", services.getCollectionId());
        assertEquals(1, services.getVectorStore().count("kb-a", null).join());
    }

    @Test
    void vectorStore_rejectsForeignCollectionWithoutTouchingIt() {
        store.upsert("kb-b", List.of("y"), List.of(new float[8])).join();

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> services.getVectorStore().delete("kb-b", null, java.util.Map.of()).join());

        assertInstanceOf(CollectionNotFoundException.class, thrown.getCause());
        assertEquals(1, store.count("kb-b", null).join());
    }

    @Test
    void fileStream_closesExactlyOnce() {
        OpenedFileStream opened = services.getFileStream("doc.txt").join();
        assertEquals(1, services.getOpenFileStreamCount());

        services.closeFileStream(opened.handle()).join();
        assertEquals(0, services.getOpenFileStreamCount());

        CompletionException second = assertThrows(CompletionException.class,
                () -> services.closeFileStream(opened.handle()).join());
        assertInstanceOf(FileServiceException.class, second.getCause());
    }

    @Test
    void fileStream_unknownHandleAndMissingFileFail() {
        assertThrows(CompletionException.class,
                () -> services.closeFileStream(FileStreamHandle.newHandle("doc.txt")).join());
        CompletionException missing = assertThrows(CompletionException.class,
                () -> services.getFileStream("absent.txt").join());
        assertInstanceOf(FileServiceException.class, missing.getCause());
        assertEquals(0, services.getOpenFileStreamCount());
    }

    @Test
    void withFileStream_releasesOnReaderFailure() {
        assertThrows(CompletionException.class, () -> services.withFileStream("doc.txt",
                in -> CompletableFuture.failedFuture(new IllegalStateException("reader failed"))).join());

        assertEquals(0, services.getOpenFileStreamCount());
    }
}
