package com.example.payments.client;

import com.example.payments.api.SubscriptionService;
import com.example.payments.error.SerializationException;
import com.example.payments.error.TransportException;
import com.example.payments.model.Page;
import com.example.payments.model.Subscription;
import com.example.payments.params.ListSubscriptions;
import com.example.payments.support.StubApiServer;
import com.example.payments.support.StubApiServer.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for BlockingHttpTransport against a real HTTP server.
 *
 * <h2>What This Tests</h2>
 * <p>The full path of a blocking pagination walk: first page through a
 * service, continuation requests built from the page URL, and errors decoded
 * from the server's error body.</p>
 */
class BlockingHttpTransportIntegrationTest {

    private StubApiServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private BlockingHttpTransport transportFor(StubApiServer server) {
        return new BlockingHttpTransport(ClientConfig.defaults().withBaseUrl(server.getBaseUrl()));
    }

    // =========================================================================
    // PAGINATION
    // =========================================================================

    @Test
    @DisplayName("Should walk every subscription with one request per page")
    void shouldWalkAllPages() {
        server = StubApiServer.create(25);
        server.start();
        BlockingHttpTransport transport = transportFor(server);

        Page<Subscription> first = Futures.await(
                new SubscriptionService(transport).list(ListSubscriptions.create().withLimit(10)));
        List<String> ids = first.stream(transport).map(Subscription::id).collect(Collectors.toList());

        assertThat(ids).hasSize(25);
        assertThat(ids.get(0)).isEqualTo("sub_1");
        assertThat(ids.get(24)).isEqualTo("sub_25");
        assertThat(server.getRequests()).extracting(RecordedRequest::query).containsExactly(
                "limit=10",
                "starting_after=sub_10&limit=10",
                "starting_after=sub_20&limit=10"
        );
    }

    @Test
    @DisplayName("Should send configured headers with every request")
    void shouldSendHeaders() {
        server = StubApiServer.create(3);
        server.start();
        BlockingHttpTransport transport = new BlockingHttpTransport(ClientConfig.defaults()
                .withBaseUrl(server.getBaseUrl())
                .withHeaders(RequestHeaders.none().withAccount("acct_1").withApiVersion("2020-08-27"))
                .withAppInfo(AppInfo.of("sync-job")));

        Futures.await(new SubscriptionService(transport).list(ListSubscriptions.create()));

        RecordedRequest request = server.getRequests().get(0);
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.header("Stripe-Account")).isEqualTo("acct_1");
        assertThat(request.header("Stripe-Version")).isEqualTo("2020-08-27");
        assertThat(request.header("User-Agent")).startsWith(ClientConfig.CLIENT_USER_AGENT).endsWith("sync-job");
    }

    // =========================================================================
    // ERROR HANDLING
    // =========================================================================

    @Test
    @DisplayName("Should yield the first page, then the server error, then end")
    void shouldSurfaceServerErrorDuringWalk() {
        server = StubApiServer.create(25).failAfter("sub_10");
        server.start();
        BlockingHttpTransport transport = transportFor(server);

        Page<Subscription> first = Futures.await(
                new SubscriptionService(transport).list(ListSubscriptions.create().withLimit(10)));
        Iterator<Subscription> iterator = first.iterator(transport);

        List<Subscription> received = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            received.add(iterator.next());
        }

        assertThatThrownBy(iterator::next)
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.getApiError().type()).isEqualTo("api_error");
                    assertThat(e.getApiError().message()).isEqualTo("Something went wrong");
                });
        assertThat(iterator.hasNext()).isFalse();
        assertThat(received).hasSize(10);
    }

    @Test
    @DisplayName("Should decode the error body of a 4xx response")
    void shouldDecodeClientError() {
        server = StubApiServer.create(0)
                .stub("GET", "/v1/subscriptions", 400,
                        "{\"error\": {\"type\": \"invalid_request_error\", \"message\": \"Bad limit\", \"param\": \"limit\"}}");
        server.start();
        BlockingHttpTransport transport = transportFor(server);

        assertThatThrownBy(() -> Futures.await(
                new SubscriptionService(transport).list(ListSubscriptions.create().withLimit(1000))))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(400);
                    assertThat(e.getApiError().param()).isEqualTo("limit");
                    assertThat(e).hasMessageContaining("Bad limit");
                });
    }

    @Test
    @DisplayName("Should report an undecodable body as a serialization failure")
    void shouldReportUndecodableBody() {
        server = StubApiServer.create(0).stub("GET", "/v1/subscriptions", 200, "not json");
        server.start();
        BlockingHttpTransport transport = transportFor(server);

        assertThatThrownBy(() -> Futures.await(
                new SubscriptionService(transport).list(ListSubscriptions.create())))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Should report a connection failure without a status")
    void shouldReportConnectionFailure() {
        StubApiServer stopped = StubApiServer.create(0);
        stopped.start();
        String baseUrl = stopped.getBaseUrl();
        stopped.close();
        BlockingHttpTransport transport = new BlockingHttpTransport(ClientConfig.defaults().withBaseUrl(baseUrl));

        assertThatThrownBy(() -> Futures.await(
                new SubscriptionService(transport).list(ListSubscriptions.create())))
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(TransportException.NO_STATUS));
    }
}
