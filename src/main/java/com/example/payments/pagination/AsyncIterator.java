package com.example.payments.pagination;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An asynchronous iterator that returns items wrapped in CompletableFuture.
 *
 * <p>Unlike {@link java.util.Iterator} which blocks on {@code hasNext()}/{@code next()},
 * this interface returns CompletableFutures that complete when the data is available.
 *
 * <p>Usage patterns:
 * <pre>{@code
 * AsyncIterator<Subscription> iterator = firstPage.asyncIterator(transport);
 *
 * // Recursive async iteration
 * iterator.nextAsync()
 *     .thenCompose(next -> {
 *         if (next.isPresent()) {
 *             process(next.get());
 *             return iterator.nextAsync();
 *         }
 *         return CompletableFuture.completedFuture(Optional.empty());
 *     });
 *
 * // Using forEachAsync
 * iterator.forEachAsync(this::process)
 *     .thenRun(() -> System.out.println("Done"));
 * }</pre>
 *
 * @param <T> the type of elements
 */
public interface AsyncIterator<T> {

    /**
     * Asynchronously retrieves the next element.
     *
     * <p>The returned CompletableFuture completes with:
     * <ul>
     *   <li>{@code Optional.of(element)} if an element is available</li>
     *   <li>{@code Optional.empty()} if iteration is complete or cancelled</li>
     *   <li>Exceptionally if fetching the next page failed; iteration ends there</li>
     * </ul>
     *
     * @return a CompletableFuture that completes with the next element or empty
     */
    CompletableFuture<Optional<T>> nextAsync();

    /**
     * Asynchronously applies an action to each remaining element.
     *
     * <p>Elements whose future is already complete are consumed in a loop; the
     * method only suspends on a future that is still pending, so long runs of
     * completed futures do not deepen the call stack.
     *
     * @param action the action to apply to each element
     * @return a CompletableFuture that completes when all elements are processed,
     *         or exceptionally with the first fetch failure or action failure
     */
    default CompletableFuture<Void> forEachAsync(Consumer<T> action) {
        while (true) {
            CompletableFuture<Optional<T>> next = nextAsync();
            if (!next.isDone() || next.isCompletedExceptionally()) {
                return next.thenCompose(opt -> {
                    if (opt.isPresent()) {
                        action.accept(opt.get());
                        return forEachAsync(action);
                    }
                    return CompletableFuture.completedFuture(null);
                });
            }

            Optional<T> opt = next.join();
            if (opt.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            try {
                action.accept(opt.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }

    /**
     * Stops the iteration. Later calls to {@code nextAsync()} complete with
     * {@code Optional.empty()} and no more requests are made.
     */
    void cancel();

    boolean isCancelled();
}
