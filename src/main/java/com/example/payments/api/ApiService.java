package com.example.payments.api;

import com.example.payments.client.ApiTransport;
import com.example.payments.error.PaymentApiException;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import com.example.payments.params.ListParams;
import com.fasterxml.jackson.databind.JavaType;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base class of the resource services: holds the transport and the list
 * request logic that every list endpoint shares.
 */
public abstract class ApiService {

    protected final ApiTransport transport;

    protected ApiService(ApiTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    public ApiTransport getTransport() {
        return transport;
    }

    /**
     * Fetches the first page of a list endpoint.
     *
     * <p>The response does not echo the request's filters, so they are stamped
     * onto the page here, without the cursor fields, to be repeated by
     * continuation requests.
     */
    protected <T extends HasCursor> CompletableFuture<Page<T>> list(
            String path,
            ListParams params,
            JavaType pageType
    ) {
        String continuationParams;
        try {
            continuationParams = transport.encode(params.withoutCursors());
        } catch (PaymentApiException e) {
            return CompletableFuture.failedFuture(e);
        }
        return transport.<Page<T>>getQuery(path, params, pageType)
                .thenApply(page -> page
                        .withParams(continuationParams.isEmpty() ? null : continuationParams)
                        .withPageType(pageType));
    }

    /**
     * Percent-encodes an id for use as a path segment.
     */
    protected static String segment(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
