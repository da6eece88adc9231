package com.chunkvault.core.queue;

import com.chunkvault.core.storage.StorageException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Last failure of a queued write.
 */
public record WriteError(
        String message,
        String exceptionType,
        boolean retryable
) {
    public static WriteError from(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        boolean retryable = cause instanceof StorageException
                || cause instanceof IOException
                || cause instanceof UncheckedIOException
                || cause instanceof TimeoutException;

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new WriteError(message, cause.getClass().getName(), retryable);
    }
}
