package com.example.payments.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings shared by both transports.
 *
 * @param baseUrl absolute URL that request paths are resolved against; ends with {@code /}
 * @param versionPrefix the path prefix list URLs are expected to carry, e.g. {@code /v1/}
 * @param connectTimeout TCP connect timeout
 * @param requestTimeout timeout of a whole request, response body included
 * @param headers optional headers sent with every request
 * @param appInfo optional application identification for the {@code User-Agent}
 */
public record ClientConfig(
        String baseUrl,
        String versionPrefix,
        Duration connectTimeout,
        Duration requestTimeout,
        RequestHeaders headers,
        AppInfo appInfo
) {

    public static final String DEFAULT_BASE_URL = "https://api.stripe.com/v1/";
    public static final String DEFAULT_VERSION_PREFIX = "/v1/";
    public static final String CLIENT_USER_AGENT = "payments-client-java/0.1";

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(versionPrefix, "versionPrefix must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        if (headers == null) {
            headers = RequestHeaders.none();
        }
    }

    public static ClientConfig defaults() {
        return new ClientConfig(
                DEFAULT_BASE_URL,
                DEFAULT_VERSION_PREFIX,
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                RequestHeaders.none(),
                null
        );
    }

    public ClientConfig withBaseUrl(String baseUrl) {
        return new ClientConfig(baseUrl, versionPrefix, connectTimeout, requestTimeout, headers, appInfo);
    }

    public ClientConfig withTimeouts(Duration connectTimeout, Duration requestTimeout) {
        return new ClientConfig(baseUrl, versionPrefix, connectTimeout, requestTimeout, headers, appInfo);
    }

    public ClientConfig withHeaders(RequestHeaders headers) {
        return new ClientConfig(baseUrl, versionPrefix, connectTimeout, requestTimeout, headers, appInfo);
    }

    public ClientConfig withAppInfo(AppInfo appInfo) {
        return new ClientConfig(baseUrl, versionPrefix, connectTimeout, requestTimeout, headers, appInfo);
    }

    /**
     * The {@code User-Agent} sent with requests: an explicit header override
     * wins, otherwise the client's own agent followed by the application info.
     */
    public String userAgent() {
        if (headers.userAgent() != null) {
            return headers.userAgent();
        }
        return appInfo != null ? CLIENT_USER_AGENT + " " + appInfo.toUserAgent() : CLIENT_USER_AGENT;
    }
}
