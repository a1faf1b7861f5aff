package com.example.payments.client;

import com.example.payments.error.PaymentApiException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Bridges the future-based transport into blocking code.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Waits for {@code future} and returns its value, rethrowing a failure as
     * the original {@link PaymentApiException} rather than a {@link CompletionException}.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw unwrap(e);
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers
     * and returns the underlying failure as a {@link PaymentApiException}.
     */
    public static PaymentApiException unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof PaymentApiException apiException) {
            return apiException;
        }
        return new PaymentApiException("Request failed: " + cause, cause);
    }
}
