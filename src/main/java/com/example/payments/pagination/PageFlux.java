package com.example.payments.pagination;

import com.example.payments.client.ApiTransport;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;

/**
 * Reactive walk over a cursor-paginated collection.
 *
 * <p>Pages are produced with {@link Flux#expand}, which drains already
 * completed fetches in a loop: the call stack does not grow with the number
 * of pages. Each page is checked before its items are emitted. The request
 * for the following page is only made when the items of the current page
 * have been consumed and another page is requested, so a cancelled
 * subscription fetches nothing more. A fetch failure terminates the Flux with
 * {@code onError}; items already emitted stay emitted.
 *
 * <p>Example usage:
 * <pre>{@code
 * PageFlux.from(firstPage, transport)
 *     .filter(subscription -> "active".equals(subscription.status()))
 *     .take(10)   // no page is fetched once 10 items have been found
 *     .subscribe(this::process);
 *
 * // Blocking for testing
 * List<Subscription> all = firstPage.flux(transport).collectList().block();
 * }</pre>
 */
public final class PageFlux {

    private static final Logger logger = LoggerFactory.getLogger(PageFlux.class);

    private PageFlux() {
    }

    /**
     * Returns a Flux of the items of {@code firstPage} followed by the items
     * of every following page.
     */
    public static <T extends HasCursor> Flux<T> from(Page<T> firstPage, ApiTransport transport) {
        return Mono.just(firstPage)
                .expand(page -> page.hasMore() && !page.isEmpty()
                        ? fetchNext(page, transport)
                        : Mono.<Page<T>>empty())
                .doOnNext(Page::requireWellFormed)
                .concatMapIterable(Page::data, 1);
    }

    /**
     * Defers the request until the page is requested downstream, not merely subscribed to.
     */
    private static <T extends HasCursor> Mono<Page<T>> fetchNext(Page<T> page, ApiTransport transport) {
        return Mono.create(sink -> sink.onRequest(n -> page.next(transport).whenComplete((next, failure) -> {
            if (failure != null) {
                sink.error(failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause()
                        : failure);
            } else {
                logger.debug("Fetched page of {} with {} items", next.url(), next.size());
                sink.success(next);
            }
        })));
    }
}
