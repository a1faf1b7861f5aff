package com.example.payments.pagination;

import com.example.payments.error.PaginationProtocolException;
import com.example.payments.error.TransportException;
import com.example.payments.model.Page;
import com.example.payments.support.RecordingTransport;
import com.example.payments.support.Thing;
import com.example.payments.support.ThingPages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PageIterator - the blocking, lazy walk over a cursor-paginated
 * collection.
 *
 * <h2>Key Behaviors</h2>
 * <ul>
 *   <li><b>Lazy fetching</b>: the next page is requested only when an item past
 *       the current page is asked for</li>
 *   <li><b>Server order</b>: items come out page after page, unchanged</li>
 *   <li><b>In-band failure</b>: a failed fetch is thrown by {@code next()} once,
 *       after every item already received</li>
 * </ul>
 */
class PageIteratorTest {

    private static final String URL = "/v1/things";

    private static Page<Thing> page(boolean hasMore, String... ids) {
        List<Thing> items = new ArrayList<>();
        for (String id : ids) {
            items.add(Thing.of(id));
        }
        return Page.of(Thing.class, items, hasMore, URL);
    }

    private static List<String> drain(Iterator<Thing> iterator) {
        List<String> ids = new ArrayList<>();
        while (iterator.hasNext()) {
            ids.add(iterator.next().id());
        }
        return ids;
    }

    // =========================================================================
    // BASIC ITERATION
    // =========================================================================

    @Test
    @DisplayName("Should return a single final page without any request")
    void shouldIterateSinglePage() {
        RecordingTransport transport = new RecordingTransport();

        List<String> ids = drain(page(false, "a", "b", "c").iterator(transport));

        assertThat(ids).containsExactly("a", "b", "c");
        assertThat(transport.requestCount()).isZero();
    }

    @Test
    @DisplayName("Should iterate all items from multiple pages in order")
    void shouldIterateMultiplePages() {
        // Given: three pages linked by the last id of each
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=b", page(true, "c", "d"))
                .respond("things?starting_after=d", page(false, "e"));

        // When
        PageIterator<Thing> iterator = new PageIterator<>(page(true, "a", "b"), transport);
        List<String> ids = drain(iterator);

        // Then
        assertThat(ids).containsExactly("a", "b", "c", "d", "e");
        assertThat(transport.requests()).containsExactly(
                "things?starting_after=b",
                "things?starting_after=d"
        );
        assertThat(iterator.getPagesFetched()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should repeat the caller's params on every continuation")
    void shouldRepeatParams() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=b&limit=2", page(true, "c", "d"))
                .respond("things?starting_after=d&limit=2", page(false));

        List<String> ids = drain(page(true, "a", "b").withParams("limit=2").iterator(transport));

        assertThat(ids).containsExactly("a", "b", "c", "d");
        assertThat(transport.requestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should handle an empty collection")
    void shouldHandleEmptyCollection() {
        RecordingTransport transport = new RecordingTransport();
        Iterator<Thing> iterator = page(false).iterator(transport);

        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
        assertThat(transport.requestCount()).isZero();
    }

    @Test
    @DisplayName("Should stop when the server reports no more data")
    void shouldTerminateOnFinalPage() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=a", page(false, "b"));
        Iterator<Thing> iterator = page(true, "a").iterator(transport);

        drain(iterator);

        assertThat(iterator.hasNext()).isFalse();
        assertThat(iterator.hasNext()).isFalse();
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    // =========================================================================
    // LAZY EVALUATION
    // =========================================================================

    @Test
    @DisplayName("Should fetch the next page only when an item past the current page is requested")
    void shouldFetchLazily() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=b", page(false, "c"));
        Iterator<Thing> iterator = page(true, "a", "b").iterator(transport);

        assertThat(iterator.next().id()).isEqualTo("a");
        assertThat(iterator.next().id()).isEqualTo("b");
        assertThat(transport.requestCount()).isZero();

        assertThat(iterator.hasNext()).isTrue();
        assertThat(transport.requestCount()).isEqualTo(1);
        assertThat(iterator.next().id()).isEqualTo("c");
    }

    @Test
    @DisplayName("Should not fetch further pages when a stream is short-circuited")
    void shouldShortCircuitStream() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=b", page(true, "c", "d"))
                .respond("things?starting_after=d", page(false, "e"));

        List<String> ids = page(true, "a", "b").stream(transport)
                .limit(3)
                .map(Thing::id)
                .collect(Collectors.toList());

        assertThat(ids).containsExactly("a", "b", "c");
        assertThat(transport.requests()).containsExactly("things?starting_after=b");
    }

    // =========================================================================
    // FAILURES
    // =========================================================================

    @Test
    @DisplayName("Should yield every received item, then the fetch failure, then end")
    void shouldReportFailureInBand() {
        TransportException failure = new TransportException(500, null, "HTTP error: 500");
        RecordingTransport transport = new RecordingTransport()
                .fail("things?starting_after=b", failure);
        Iterator<Thing> iterator = page(true, "a", "b").iterator(transport);

        assertThat(iterator.next().id()).isEqualTo("a");
        assertThat(iterator.next().id()).isEqualTo("b");

        assertThat(iterator.hasNext()).isTrue();
        assertThatThrownBy(iterator::next).isSameAs(failure);

        assertThat(iterator.hasNext()).isFalse();
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report an empty page that claims more data as a protocol error")
    void shouldRejectEmptyPageWithMore() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=a", page(true));
        Iterator<Thing> iterator = page(true, "a").iterator(transport);

        assertThat(iterator.next().id()).isEqualTo("a");
        assertThatThrownBy(iterator::next).isInstanceOf(PaginationProtocolException.class);
        assertThat(iterator.hasNext()).isFalse();
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a malformed starting page without any request")
    void shouldRejectMalformedStartingPage() {
        RecordingTransport transport = new RecordingTransport();
        Iterator<Thing> iterator = page(true).iterator(transport);

        assertThat(iterator.hasNext()).isTrue();
        assertThatThrownBy(iterator::next)
                .isInstanceOf(PaginationProtocolException.class)
                .hasMessageContaining(URL);
        assertThat(transport.requestCount()).isZero();
    }

    // =========================================================================
    // LONG WALKS
    // =========================================================================

    @Test
    @DisplayName("Should walk thousands of pages in order with one request per page")
    void shouldWalkThousandsOfPages() {
        RecordingTransport transport = new RecordingTransport();
        Page<Thing> first = ThingPages.singleItemChain(transport, 5_000);

        PageIterator<Thing> iterator = new PageIterator<>(first, transport);
        List<String> ids = drain(iterator);

        assertThat(ids).hasSize(5_000);
        assertThat(ids.get(0)).isEqualTo("t_0");
        assertThat(ids.get(4_999)).isEqualTo("t_4999");
        assertThat(iterator.getPagesFetched()).isEqualTo(4_999);
        assertThat(iterator.hasNext()).isFalse();
    }

    @Test
    @DisplayName("Should stream thousands of pages")
    void shouldStreamThousandsOfPages() {
        RecordingTransport transport = new RecordingTransport();
        Page<Thing> first = ThingPages.singleItemChain(transport, 5_000);

        long count = first.stream(transport).count();

        assertThat(count).isEqualTo(5_000L);
        assertThat(transport.requestCount()).isEqualTo(4_999);
    }
}
