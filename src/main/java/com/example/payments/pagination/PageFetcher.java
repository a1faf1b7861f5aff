package com.example.payments.pagination;

import com.example.payments.client.ApiTransport;
import com.example.payments.error.UnsupportedVersionException;
import com.example.payments.model.HasCursor;
import com.example.payments.model.Page;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Builds and issues the request for the page that follows a given cursor.
 *
 * <p>A list URL reported by the server, e.g. {@code /v1/subscriptions?status=active},
 * becomes the continuation request
 * <pre>{@code
 * GET subscriptions?status=active&starting_after=sub_42&limit=5
 * }</pre>
 * where {@code sub_42} is the cursor of the last item already seen and
 * {@code limit=5} the caller's encoded parameters.
 *
 * <p>No retry is attempted: a failure of the transport fails the returned
 * future unchanged.
 */
public final class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    static final String CURSOR_PARAM = "starting_after";

    private PageFetcher() {
    }

    /**
     * Fetches the page after {@code cursor}.
     *
     * @param transport the transport to issue the GET through
     * @param pageType the Jackson type of the page to decode
     * @param url the list URL as reported by the server, version prefix included
     * @param cursor the cursor of the last item of the previous page
     * @param params the caller's encoded parameters, or {@code null}
     * @return future completing with the next page, which carries {@code params}
     *         and {@code pageType} again; fails with {@link UnsupportedVersionException}
     *         without any request if {@code url} lacks the transport's version prefix
     */
    public static <T extends HasCursor> CompletableFuture<Page<T>> fetchNext(
            ApiTransport transport,
            JavaType pageType,
            String url,
            String cursor,
            String params
    ) {
        String prefix = transport.versionPrefix();
        if (!url.startsWith(prefix)) {
            return CompletableFuture.failedFuture(new UnsupportedVersionException(url, prefix));
        }

        String path = continuationPath(url.substring(prefix.length()), cursor, params);
        logger.debug("Fetching page after {}: {}", cursor, path);

        return transport.<Page<T>>get(path, pageType)
                .thenApply(page -> page.withParams(params).withPageType(pageType));
    }

    static String continuationPath(String path, String cursor, String params) {
        StringBuilder sb = new StringBuilder(path);
        sb.append(path.contains("?") ? '&' : '?')
                .append(CURSOR_PARAM)
                .append('=')
                .append(URLEncoder.encode(cursor, StandardCharsets.UTF_8));
        if (params != null && !params.isEmpty()) {
            sb.append('&').append(params);
        }
        return sb.toString();
    }
}
