package com.example.payments.pagination;

import com.example.payments.client.ApiTransport;
import com.example.payments.error.PaginationProtocolException;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An AsyncIterator over a whole cursor-paginated collection, starting from a
 * page that has already been fetched.
 *
 * <p>This is the async equivalent of {@link PageIterator}:
 * <ul>
 *   <li>Page fetching is non-blocking</li>
 *   <li>{@code nextAsync()} returns immediately while a page is being fetched</li>
 *   <li>Supports cancellation to stop further requests</li>
 * </ul>
 *
 * <p>A failed fetch completes that {@code nextAsync()} exceptionally with the
 * transport's exception (wrapped in a {@link java.util.concurrent.CompletionException}
 * by {@code join()}); every later call completes with empty.
 *
 * <p><b>Thread Safety:</b> state is held in atomic references, but calls are
 * expected to be sequential: the next {@code nextAsync()} is issued after the
 * previous one completed.
 *
 * @param <T> the type of items in each page
 */
public class AsyncPageIterator<T extends HasCursor> implements AsyncIterator<T> {

    private static final Logger logger = LoggerFactory.getLogger(AsyncPageIterator.class);

    private final ApiTransport transport;

    private final AtomicReference<Page<T>> currentPage;
    private final AtomicReference<Iterator<T>> currentPageIterator;
    private final AtomicReference<RuntimeException> pendingError;
    private final AtomicBoolean finished;
    private final AtomicBoolean cancelled;

    /**
     * Creates an iterator that starts with the items of {@code firstPage}.
     *
     * @param firstPage the page to start from
     * @param transport the transport used for continuation requests
     */
    public AsyncPageIterator(Page<T> firstPage, ApiTransport transport) {
        this.transport = transport;
        this.currentPage = new AtomicReference<>(firstPage);
        this.currentPageIterator = new AtomicReference<>(firstPage.data().iterator());
        this.pendingError = new AtomicReference<>(
                firstPage.isEmpty() && firstPage.hasMore()
                        ? new PaginationProtocolException(firstPage.url())
                        : null);
        this.finished = new AtomicBoolean(false);
        this.cancelled = new AtomicBoolean(false);
    }

    @Override
    public CompletableFuture<Optional<T>> nextAsync() {
        if (cancelled.get() || finished.get()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        RuntimeException error = pendingError.getAndSet(null);
        if (error != null) {
            finished.set(true);
            return CompletableFuture.failedFuture(error);
        }

        Iterator<T> pageIter = currentPageIterator.get();
        if (pageIter.hasNext()) {
            return CompletableFuture.completedFuture(Optional.of(pageIter.next()));
        }

        Page<T> page = currentPage.get();
        if (!page.hasMore()) {
            finished.set(true);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return fetchNextPageAsync(page).thenCompose(fetched -> {
            if (!fetched) {
                return CompletableFuture.completedFuture(Optional.<T>empty());
            }
            return nextAsync();
        });
    }

    /**
     * Asynchronously fetches the page after {@code page}.
     *
     * @return CompletableFuture that completes with true if a page was installed
     */
    private CompletableFuture<Boolean> fetchNextPageAsync(Page<T> page) {
        return page.next(transport)
                .whenComplete((next, failure) -> {
                    if (failure != null) {
                        logger.debug("Stopping iteration of {} after fetch failure", page.url(), failure);
                        finished.set(true);
                    }
                })
                .thenApply(next -> {
                    if (cancelled.get()) {
                        return false;
                    }
                    logger.debug("Fetched page of {} with {} items", next.url(), next.size());
                    currentPage.set(next);
                    currentPageIterator.set(next.data().iterator());
                    if (next.isEmpty() && next.hasMore()) {
                        pendingError.set(new PaginationProtocolException(next.url()));
                    }
                    return true;
                });
    }

    @Override
    public void cancel() {
        cancelled.set(true);
        finished.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns true if no more items will be returned.
     */
    public boolean isFinished() {
        return finished.get();
    }
}
