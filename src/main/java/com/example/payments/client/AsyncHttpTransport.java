package com.example.payments.client;

import com.example.payments.error.TransportException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Transport that uses {@link HttpClient#sendAsync} for non-blocking I/O.
 *
 * <p>This is the non-blocking equivalent of {@link BlockingHttpTransport}.
 * Futures complete on the HTTP client's executor.
 *
 * <p>Example usage:
 * <pre>{@code
 * ApiTransport transport = new AsyncHttpTransport(ClientConfig.defaults());
 *
 * new SubscriptionService(transport).list(ListSubscriptions.create())
 *     .thenApply(page -> page.flux(transport))
 *     .thenAccept(flux -> flux.subscribe(this::process));
 * }</pre>
 */
public class AsyncHttpTransport extends AbstractHttpTransport {

    public AsyncHttpTransport(ClientConfig config) {
        super(config);
    }

    public AsyncHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, ClientConfig config) {
        super(httpClient, objectMapper, config);
    }

    @Override
    protected <T> CompletableFuture<T> execute(HttpRequest request, JavaType responseType) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, failure) -> {
                    if (failure != null) {
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause()
                                : failure;
                        throw new TransportException(
                                "Request failed: " + request.method() + " " + request.uri(), cause);
                    }
                    return this.<T>decode(request, response, responseType);
                });
    }
}
