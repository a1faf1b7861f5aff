package com.example.payments.client;

import com.example.payments.error.PaymentApiException;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

/**
 * The HTTP capability the client is built on.
 *
 * <p>Paths are relative to the configured API base URL, e.g.
 * {@code subscriptions?limit=3}. Every method issues exactly one request and
 * returns a future that completes with the decoded body, or fails with a
 * {@link com.example.payments.error.PaymentApiException}. Implementations
 * perform no retries.
 *
 * <p>Two implementations are provided and picked when the client is put together:
 * <ul>
 *   <li>{@link BlockingHttpTransport} runs the request on the calling thread and
 *       returns an already completed future</li>
 *   <li>{@link AsyncHttpTransport} returns immediately and completes the future
 *       when the response arrives</li>
 * </ul>
 *
 * <p>Implementations are thread-safe and may be shared by any number of
 * concurrent pagination walks.
 */
public interface ApiTransport {

    <T> CompletableFuture<T> get(String path, JavaType responseType);

    <T> CompletableFuture<T> postForm(String path, Object form, JavaType responseType);

    <T> CompletableFuture<T> post(String path, JavaType responseType);

    <T> CompletableFuture<T> delete(String path, JavaType responseType);

    /**
     * Issues a GET with {@code params} encoded into the query string.
     */
    default <T> CompletableFuture<T> getQuery(String path, Object params, JavaType responseType) {
        String query;
        try {
            query = encode(params);
        } catch (PaymentApiException e) {
            return CompletableFuture.failedFuture(e);
        }
        return get(appendQuery(path, query), responseType);
    }

    /**
     * Encodes a parameter object the way this transport puts it on the wire.
     */
    default String encode(Object params) {
        return FormEncoder.shared().encode(params);
    }

    /**
     * The version prefix that list URLs returned by the server must start with.
     */
    default String versionPrefix() {
        return ClientConfig.DEFAULT_VERSION_PREFIX;
    }

    /**
     * Appends an encoded query fragment, using {@code ?} or {@code &} as the path requires.
     */
    static String appendQuery(String path, String query) {
        if (query == null || query.isEmpty()) {
            return path;
        }
        return path + (path.contains("?") ? "&" : "?") + query;
    }
}
