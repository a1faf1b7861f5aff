package com.example.payments.pagination;

import com.example.payments.client.ApiTransport;
import com.example.payments.client.Futures;
import com.example.payments.error.PaginationProtocolException;
import com.example.payments.error.PaymentApiException;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An Iterator over a whole cursor-paginated collection, starting from a page
 * that has already been fetched.
 *
 * <p>It ensures that:
 * <ul>
 *   <li>The next page is only fetched once the current one is exhausted and
 *       another item is asked for</li>
 *   <li>Only one page is held in memory at a time</li>
 *   <li>Items come out in server order, page after page</li>
 * </ul>
 *
 * <p>Each page fetch blocks the calling thread until the transport's future
 * completes.
 *
 * <p>A failed fetch ends the iteration in-band: {@link #hasNext()} still
 * returns {@code true}, the following {@link #next()} throws the
 * {@link PaymentApiException}, and the iterator is exhausted afterwards.
 *
 * <p>Example usage:
 * <pre>{@code
 * Iterator<Subscription> iterator = firstPage.iterator(transport);
 *
 * while (iterator.hasNext()) {
 *     Subscription subscription = iterator.next();
 *     // Process subscription
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <T> the type of items in each page
 */
public class PageIterator<T extends HasCursor> implements Iterator<T> {

    private static final Logger logger = LoggerFactory.getLogger(PageIterator.class);

    private final ApiTransport transport;

    private Page<T> currentPage;
    private Iterator<T> currentPageIterator;
    private PaymentApiException pendingError;
    private boolean finished = false;
    private int pagesFetched = 0;

    /**
     * Creates an iterator that starts with the items of {@code firstPage}.
     * No request is made until the first page is exhausted.
     *
     * @param firstPage the page to start from
     * @param transport the transport used for continuation requests
     */
    public PageIterator(Page<T> firstPage, ApiTransport transport) {
        this.transport = transport;
        install(firstPage);
    }

    /**
     * Returns {@code true} if there are more items, or a pending failure, to return.
     *
     * <p>This method may block on a page fetch if the current page is
     * exhausted and the server reported more data.
     */
    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (pendingError != null) {
            return true;
        }

        while (!currentPageIterator.hasNext()) {
            if (!fetchNextPage()) {
                return pendingError != null;
            }
        }

        return true;
    }

    /**
     * Returns the next item.
     *
     * @throws PaymentApiException if fetching the next page failed
     * @throws NoSuchElementException if no more items are available
     */
    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        if (pendingError != null) {
            PaymentApiException error = pendingError;
            pendingError = null;
            finished = true;
            throw error;
        }
        return currentPageIterator.next();
    }

    /**
     * Number of continuation pages fetched so far; the starting page is not counted.
     */
    public int getPagesFetched() {
        return pagesFetched;
    }

    /**
     * Fetches the page after the current one.
     *
     * @return true if a page was installed, false if iteration ended or failed
     */
    private boolean fetchNextPage() {
        if (!currentPage.hasMore()) {
            finished = true;
            return false;
        }

        try {
            Page<T> page = Futures.await(currentPage.next(transport));
            pagesFetched++;
            logger.debug("Fetched page {} of {} with {} items", pagesFetched, page.url(), page.size());
            return install(page);
        } catch (PaymentApiException e) {
            logger.debug("Stopping iteration of {} after fetch failure", currentPage.url(), e);
            pendingError = e;
            return false;
        }
    }

    private boolean install(Page<T> page) {
        currentPage = page;
        currentPageIterator = page.data().iterator();
        if (page.isEmpty() && page.hasMore()) {
            pendingError = new PaginationProtocolException(page.url());
            return false;
        }
        return true;
    }
}
