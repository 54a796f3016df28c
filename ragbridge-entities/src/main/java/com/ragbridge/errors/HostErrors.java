package com.ragbridge.errors;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for failures that arrive through {@link java.util.concurrent.CompletableFuture} callbacks.
 */
public final class HostErrors {

    private HostErrors() {
    }

    /** Strips {@link CompletionException} / {@link ExecutionException} wrappers. */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Converts a failed host call into the exception a plugin should surface: host-origin failures become
     * {@link HostServiceException}; anything else is returned unchanged (unwrapped) so it still propagates.
     *
     * @param operation short description of the host call (e.g. "embed chunks")
     * @param error     failure as received from the future
     */
    public static Throwable toPluginFailure(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof HostCapabilityException) {
            return new HostServiceException("Host service call failed (" + operation + ")", (HostCapabilityException) cause);
        }
        return cause;
    }

    /** Wraps for rethrow inside a future stage without adding a second wrapper. */
    public static CompletionException asCompletion(Throwable error) {
        return error instanceof CompletionException ? (CompletionException) error : new CompletionException(error);
    }
}
