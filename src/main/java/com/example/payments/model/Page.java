package com.example.payments.model;

import com.example.payments.client.ApiTransport;
import com.example.payments.error.PaginationProtocolException;
import com.example.payments.pagination.AsyncIterator;
import com.example.payments.pagination.AsyncPageIterator;
import com.example.payments.pagination.PageCollector;
import com.example.payments.pagination.PageFetcher;
import com.example.payments.pagination.PageFlux;
import com.example.payments.pagination.PageIterator;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single page of a cursor-paginated list.
 *
 * <p>Example API response:
 * <pre>{@code
 * {
 *   "object": "list",
 *   "data": [ {"id": "sub_1", ...}, {"id": "sub_2", ...} ],
 *   "has_more": true,
 *   "url": "/v1/subscriptions"
 * }
 * }</pre>
 *
 * <p>Two values are not part of the wire format and are stamped onto the page
 * after it has been decoded: the caller's encoded query parameters, which
 * continuation requests must repeat, and the page's own type, which is needed
 * to decode the continuation response. Both are attached through
 * {@link #withParams(String)} and {@link #withPageType(JavaType)}, which
 * return copies; a page is otherwise immutable.
 *
 * <p>Example usage:
 * <pre>{@code
 * Page<Subscription> first = subscriptions.list(ListSubscriptions.create()).join();
 *
 * // One more page
 * Page<Subscription> second = first.next(transport).join();
 *
 * // Everything, lazily
 * for (Iterator<Subscription> it = first.iterator(transport); it.hasNext(); ) {
 *     process(it.next());
 * }
 * }</pre>
 *
 * @param <T> the type of items in the page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Page<T extends HasCursor> {

    private final List<T> data;
    private final boolean hasMore;
    private final Long totalCount;
    private final String url;
    private final String params;
    private final JavaType pageType;

    @JsonCreator
    public Page(
            @JsonProperty("data") List<T> data,
            @JsonProperty("has_more") boolean hasMore,
            @JsonProperty("total_count") Long totalCount,
            @JsonProperty("url") String url
    ) {
        this(data, hasMore, totalCount, url, null, null);
    }

    private Page(
            List<T> data,
            boolean hasMore,
            Long totalCount,
            String url,
            String params,
            JavaType pageType
    ) {
        this.data = data != null ? List.copyOf(data) : List.of();
        this.hasMore = hasMore;
        this.totalCount = totalCount;
        this.url = url != null ? url : "";
        this.params = params;
        this.pageType = pageType;
    }

    /**
     * Returns the Jackson type of a page of {@code itemClass}.
     */
    public static <T extends HasCursor> JavaType typeOf(Class<T> itemClass) {
        return TypeFactory.defaultInstance().constructParametricType(Page.class, itemClass);
    }

    /**
     * Creates a page that is able to fetch its continuation.
     */
    public static <T extends HasCursor> Page<T> of(
            Class<T> itemClass,
            List<T> data,
            boolean hasMore,
            String url
    ) {
        return new Page<>(data, hasMore, null, url, null, typeOf(itemClass));
    }

    /**
     * Creates an empty, final page.
     */
    public static <T extends HasCursor> Page<T> empty(Class<T> itemClass, String url) {
        return of(itemClass, List.of(), false, url);
    }

    /**
     * Returns the items in server order.
     */
    public List<T> data() {
        return data;
    }

    /**
     * Returns {@code true} if the server holds items beyond this page.
     */
    public boolean hasMore() {
        return hasMore;
    }

    /**
     * Total number of items across all pages, for endpoints that report it.
     */
    public OptionalLong totalCount() {
        return totalCount != null ? OptionalLong.of(totalCount) : OptionalLong.empty();
    }

    /**
     * The endpoint path this page was fetched from, including the version prefix.
     */
    public String url() {
        return url;
    }

    /**
     * The caller's encoded filter parameters, repeated on every continuation request.
     */
    public Optional<String> params() {
        return Optional.ofNullable(params);
    }

    /**
     * The Jackson type used to decode continuation pages, or {@code null} if
     * none has been stamped yet.
     */
    public JavaType pageType() {
        return pageType;
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Returns a copy of this page carrying the given encoded query parameters.
     */
    public Page<T> withParams(String params) {
        return new Page<>(data, hasMore, totalCount, url, params, pageType);
    }

    /**
     * Returns a copy of this page that decodes its continuation as {@code pageType}.
     */
    public Page<T> withPageType(JavaType pageType) {
        return new Page<>(data, hasMore, totalCount, url, params, pageType);
    }

    /**
     * Checks the one structural rule of the protocol: a page may only be empty
     * when the whole collection is.
     *
     * @throws PaginationProtocolException if the page is empty but reports more data
     */
    public void requireWellFormed() {
        if (data.isEmpty() && hasMore) {
            throw new PaginationProtocolException(url);
        }
    }

    /**
     * Fetches the page following this one.
     *
     * <p>An empty final page yields another empty page without any request.
     * Exactly one GET is issued otherwise, using the cursor of the last item.
     *
     * @param transport the transport to issue the request through
     * @return future completing with the next page
     */
    public CompletableFuture<Page<T>> next(ApiTransport transport) {
        if (data.isEmpty()) {
            if (hasMore) {
                return CompletableFuture.failedFuture(new PaginationProtocolException(url));
            }
            return CompletableFuture.completedFuture(
                    new Page<>(List.of(), false, totalCount, url, params, pageType));
        }
        if (pageType == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Page type is unknown; create pages with Page.of or obtain them from a service"));
        }
        String cursor = data.get(data.size() - 1).cursor();
        return PageFetcher.fetchNext(transport, pageType, url, cursor, params);
    }

    /**
     * Returns a blocking, lazy iterator over this page and all following pages.
     * The iterator is single-use.
     */
    public Iterator<T> iterator(ApiTransport transport) {
        return new PageIterator<>(this, transport);
    }

    /**
     * Returns a sequential, lazy stream over this page and all following pages.
     */
    public Stream<T> stream(ApiTransport transport) {
        Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(
                iterator(transport),
                Spliterator.ORDERED | Spliterator.NONNULL
        );
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Returns a non-blocking iterator over this page and all following pages.
     */
    public AsyncIterator<T> asyncIterator(ApiTransport transport) {
        return new AsyncPageIterator<>(this, transport);
    }

    /**
     * Returns a Flux over this page and all following pages. Each
     * subscription walks the collection from this page.
     */
    public Flux<T> flux(ApiTransport transport) {
        return PageFlux.from(this, transport);
    }

    /**
     * Fetches every remaining page and completes with all items in order.
     * The first failure fails the future; partial results are discarded.
     */
    public CompletableFuture<List<T>> collectAll(ApiTransport transport) {
        return PageCollector.collectAll(this, transport);
    }

    @Override
    public String toString() {
        return "Page{url=" + url + ", size=" + data.size() + ", hasMore=" + hasMore
                + (params != null ? ", params=" + params : "") + "}";
    }
}
