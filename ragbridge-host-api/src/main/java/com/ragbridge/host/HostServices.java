package com.ragbridge.host;

import com.ragbridge.entities.FileStreamHandle;
import com.ragbridge.errors.HostErrors;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * The only channel from a plugin instance to host infrastructure. Each instance is bound to exactly one
 * collection for its lifetime: the vector store it exposes refuses every other collection id, so a plugin holding
 * one {@code HostServices} can affect only that collection and the files it is handed paths to.
 * <p>
 * Safe for concurrent use by the plugin instance it was issued to. Must not be shared across plugin instances
 * bound to different collections. File streams are single-consumer.
 */
public interface HostServices {

    Embedder getEmbedder();

    /** Vector store restricted to {@link #getCollectionId()}. */
    VectorStore getVectorStore();

    /** Collection assigned to this plugin instance. */
    String getCollectionId();

    /**
     * Opens a file for reading. Every successful call must be matched by exactly one
     * {@link #closeFileStream(FileStreamHandle)}; prefer {@link #withFileStream}, which guarantees it.
     *
     * @param storagePath opaque key from {@link com.ragbridge.entities.FileObject#storagePath()}
     * @return future of the stream and its release handle; fails with
     *         {@link com.ragbridge.errors.FileServiceException}
     */
    CompletableFuture<OpenedFileStream> getFileStream(String storagePath);

    /**
     * Releases a stream opened by {@link #getFileStream}. Fails with
     * {@link com.ragbridge.errors.FileServiceException} for an unknown or already released handle.
     */
    CompletableFuture<Void> closeFileStream(FileStreamHandle handle);

    /**
     * Opens {@code storagePath}, hands the stream to {@code reader} and releases the handle exactly once when the
     * reader's future completes, whether normally, exceptionally or by cancellation of the returned future.
     * A release failure after a reader failure is attached as suppressed; after a reader success it fails the call.
     * Cancelling the returned future cancels the reader's future and releases the stream, also when the cancel
     * arrives before the stream has opened.
     *
     * @param storagePath opaque storage key
     * @param reader      consumes the stream; must finish reading before its future completes
     * @param <T>         reader result type
     * @return future of the reader's result
     */
    default <T> CompletableFuture<T> withFileStream(String storagePath,
                                                    Function<InputStream, CompletableFuture<T>> reader) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicBoolean released = new AtomicBoolean();
        AtomicReference<OpenedFileStream> openedRef = new AtomicReference<>();
        AtomicReference<CompletableFuture<T>> readerRef = new AtomicReference<>();
        Function<OpenedFileStream, CompletableFuture<Void>> release = opened -> released.compareAndSet(false, true)
                ? closeFileStream(opened.handle())
                : CompletableFuture.completedFuture(null);

        result.whenComplete((value, error) -> {
            if (!result.isCancelled()) return;
            CompletableFuture<T> pending = readerRef.get();
            if (pending != null) pending.cancel(true);
            OpenedFileStream opened = openedRef.get();
            if (opened != null) release.apply(opened);
        });

        getFileStream(storagePath).whenComplete((opened, openError) -> {
            if (openError != null) {
                result.completeExceptionally(HostErrors.unwrap(openError));
                return;
            }
            openedRef.set(opened);
            if (result.isDone()) {
                // cancelled while opening
                release.apply(opened);
                return;
            }
            CompletableFuture<T> body;
            try {
                body = reader.apply(opened.stream());
                if (body == null) {
                    body = CompletableFuture.failedFuture(new IllegalStateException("reader returned null"));
                }
            } catch (RuntimeException e) {
                body = CompletableFuture.failedFuture(e);
            }
            readerRef.set(body);
            if (result.isCancelled()) body.cancel(true);
            body.whenComplete((value, error) -> release.apply(opened)
                    .whenComplete((ignored, closeError) -> {
                        if (error != null) {
                            Throwable cause = HostErrors.unwrap(error);
                            if (closeError != null) cause.addSuppressed(HostErrors.unwrap(closeError));
                            result.completeExceptionally(cause);
                        } else if (closeError != null) {
                            result.completeExceptionally(HostErrors.unwrap(closeError));
                        } else {
                            result.complete(value);
                        }
                    }));
        });
        return result;
    }
}
