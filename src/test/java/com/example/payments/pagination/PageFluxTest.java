package com.example.payments.pagination;

import com.example.payments.error.PaginationProtocolException;
import com.example.payments.error.TransportException;
import com.example.payments.model.Page;
import com.example.payments.support.RecordingTransport;
import com.example.payments.support.Thing;
import com.example.payments.support.ThingPages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PageFlux - the reactive walk over a cursor-paginated collection.
 *
 * <h2>Key Concepts</h2>
 * <ul>
 *   <li><b>Flux.defer()</b>: nothing happens until subscription</li>
 *   <li><b>concatWith()</b>: the next page is requested after the current page's items</li>
 *   <li><b>take()</b>: cancelling the subscription stops further requests</li>
 * </ul>
 */
class PageFluxTest {

    private static Page<Thing> page(boolean hasMore, String... ids) {
        List<Thing> items = new ArrayList<>();
        for (String id : ids) {
            items.add(Thing.of(id));
        }
        return Page.of(Thing.class, items, hasMore, "/v1/things");
    }

    private RecordingTransport threePages() {
        return new RecordingTransport()
                .respond("things?starting_after=b", page(true, "c", "d"))
                .respond("things?starting_after=d", page(false, "e"));
    }

    // =========================================================================
    // BASIC STREAMING
    // =========================================================================

    @Test
    @DisplayName("Should emit all items across pages in order")
    void shouldEmitAllItems() {
        RecordingTransport transport = threePages();

        List<String> ids = page(true, "a", "b").flux(transport)
                .map(Thing::id)
                .collectList()
                .block();

        assertThat(ids).containsExactly("a", "b", "c", "d", "e");
        assertThat(transport.requestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not make any request before subscription")
    void shouldBeLazyUntilSubscribed() {
        RecordingTransport transport = threePages();

        Flux<Thing> flux = PageFlux.from(page(true, "a", "b"), transport);

        assertThat(transport.requestCount()).isZero();
        assertThat(flux.count().block()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should complete without a request for an empty collection")
    void shouldHandleEmptyCollection() {
        RecordingTransport transport = new RecordingTransport();

        assertThat(page(false).flux(transport).collectList().block()).isEmpty();
        assertThat(transport.requestCount()).isZero();
    }

    // =========================================================================
    // EARLY TERMINATION
    // =========================================================================

    @Test
    @DisplayName("Should stop fetching once take() is satisfied")
    void shouldStopFetchingAfterTake() {
        RecordingTransport transport = threePages();

        List<String> ids = page(true, "a", "b").flux(transport)
                .take(3)
                .map(Thing::id)
                .collectList()
                .block();

        assertThat(ids).containsExactly("a", "b", "c");
        assertThat(transport.requests()).containsExactly("things?starting_after=b");
    }

    @Test
    @DisplayName("Should walk the collection again for every subscriber")
    void shouldRewalkOnResubscribe() {
        RecordingTransport transport = threePages();
        Flux<Thing> flux = page(true, "a", "b").flux(transport);

        flux.blockLast();
        flux.blockLast();

        assertThat(transport.requestCount()).isEqualTo(4);
    }

    // =========================================================================
    // ERROR HANDLING
    // =========================================================================

    @Test
    @DisplayName("Should emit received items and then terminate with the fetch failure")
    void shouldTerminateWithFetchFailure() {
        TransportException failure = new TransportException(500, null, "HTTP error: 500");
        RecordingTransport transport = new RecordingTransport()
                .fail("things?starting_after=b", failure);

        List<String> received = new ArrayList<>();
        AtomicReference<Throwable> error = new AtomicReference<>();
        page(true, "a", "b").flux(transport)
                .doOnNext(thing -> received.add(thing.id()))
                .doOnError(error::set)
                .onErrorResume(e -> Flux.empty())
                .blockLast();

        assertThat(received).containsExactly("a", "b");
        assertThat(error.get()).isSameAs(failure);
    }

    @Test
    @DisplayName("Should signal a protocol error for an empty page that claims more data")
    void shouldSignalProtocolError() {
        RecordingTransport transport = new RecordingTransport()
                .respond("things?starting_after=a", page(true));

        assertThatThrownBy(() -> page(true, "a").flux(transport).blockLast())
                .isInstanceOf(PaginationProtocolException.class);
    }

    // =========================================================================
    // LONG WALKS
    // =========================================================================

    @Test
    @DisplayName("Should emit thousands of already fetched pages without growing the stack")
    void shouldWalkThousandsOfPages() {
        RecordingTransport transport = new RecordingTransport();
        Page<Thing> first = ThingPages.singleItemChain(transport, 5_000);

        List<String> ids = first.flux(transport)
                .map(Thing::id)
                .collectList()
                .block(Duration.ofSeconds(30));

        assertThat(ids).hasSize(5_000);
        assertThat(ids.get(0)).isEqualTo("t_0");
        assertThat(ids.get(4_999)).isEqualTo("t_4999");
        assertThat(transport.requestCount()).isEqualTo(4_999);
    }

    @Test
    @DisplayName("Should terminate with the failure at the end of a long walk")
    void shouldFailAtEndOfLongWalk() {
        RecordingTransport transport = new RecordingTransport();
        Page<Thing> first = ThingPages.singleItemChain(transport, 3_000);
        TransportException failure = new TransportException(500, null, "HTTP error: 500");
        transport.fail("things?starting_after=t_1999", failure);

        List<String> received = new ArrayList<>();
        assertThatThrownBy(() -> first.flux(transport)
                .doOnNext(thing -> received.add(thing.id()))
                .blockLast(Duration.ofSeconds(30)))
                .isSameAs(failure);

        assertThat(received).hasSize(2_000);
    }
}
