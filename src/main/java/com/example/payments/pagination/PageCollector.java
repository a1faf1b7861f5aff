package com.example.payments.pagination;

import com.example.payments.client.ApiTransport;
import com.example.payments.error.PaginationProtocolException;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Eagerly collects a whole cursor-paginated collection into one list.
 *
 * <p>Pages are fetched one after another while the server reports more data.
 * The first failure fails the returned future and the items gathered so far
 * are dropped: callers get either every item or an error.
 */
public final class PageCollector {

    private static final Logger logger = LoggerFactory.getLogger(PageCollector.class);

    private PageCollector() {
    }

    /**
     * Collects the items of {@code firstPage} and of every following page, in order.
     *
     * @return future completing with an unmodifiable list of all items
     */
    public static <T extends HasCursor> CompletableFuture<List<T>> collectAll(
            Page<T> firstPage,
            ApiTransport transport
    ) {
        List<T> items = new ArrayList<>();
        return accumulate(firstPage, transport, items)
                .thenApply(done -> {
                    logger.debug("Collected {} items from {}", items.size(), firstPage.url());
                    return List.copyOf(items);
                });
    }

    /**
     * Loops over pages whose fetch has already completed and only chains a
     * continuation on a fetch that is still pending, so the stack stays flat
     * however many pages the collection has.
     */
    private static <T extends HasCursor> CompletableFuture<Void> accumulate(
            Page<T> firstPage,
            ApiTransport transport,
            List<T> items
    ) {
        Page<T> page = firstPage;
        while (true) {
            try {
                page.requireWellFormed();
            } catch (PaginationProtocolException e) {
                return CompletableFuture.failedFuture(e);
            }

            items.addAll(page.data());
            if (!page.hasMore()) {
                return CompletableFuture.completedFuture(null);
            }

            CompletableFuture<Page<T>> next = page.next(transport);
            if (!next.isDone() || next.isCompletedExceptionally()) {
                return next.thenCompose(fetched -> accumulate(fetched, transport, items));
            }
            page = next.join();
        }
    }
}
