package com.example.payments.client;

import com.example.payments.error.PaymentApiException;
import com.example.payments.error.TransportException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Transport that performs each request on the calling thread.
 *
 * <p>The returned futures are already complete, so callers may {@code join()}
 * them without blocking any further.
 *
 * <p>Example usage:
 * <pre>{@code
 * ApiTransport transport = new BlockingHttpTransport(ClientConfig.defaults());
 * SubscriptionService subscriptions = new SubscriptionService(transport);
 *
 * Page<Subscription> page = Futures.await(subscriptions.list(ListSubscriptions.create()));
 * page.stream(transport).forEach(System.out::println);
 * }</pre>
 */
public class BlockingHttpTransport extends AbstractHttpTransport {

    public BlockingHttpTransport(ClientConfig config) {
        super(config);
    }

    public BlockingHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, ClientConfig config) {
        super(httpClient, objectMapper, config);
    }

    @Override
    protected <T> CompletableFuture<T> execute(HttpRequest request, JavaType responseType) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Request failed: " + request.method() + " " + request.uri(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(
                    new TransportException("Interrupted during " + request.method() + " " + request.uri(), e));
        }

        try {
            T body = decode(request, response, responseType);
            return CompletableFuture.completedFuture(body);
        } catch (PaymentApiException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
