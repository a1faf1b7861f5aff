package com.example.payments.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional headers sent with every request.
 *
 * @param clientId the platform's client id, sent as {@code Client-Id}
 * @param apiVersion pins the API version, sent as {@code Stripe-Version}
 * @param account acts on behalf of a connected account, sent as {@code Stripe-Account}
 * @param userAgent overrides the default {@code User-Agent}
 */
public record RequestHeaders(
        String clientId,
        String apiVersion,
        String account,
        String userAgent
) {

    public static RequestHeaders none() {
        return new RequestHeaders(null, null, null, null);
    }

    public RequestHeaders withAccount(String account) {
        return new RequestHeaders(clientId, apiVersion, account, userAgent);
    }

    public RequestHeaders withApiVersion(String apiVersion) {
        return new RequestHeaders(clientId, apiVersion, account, userAgent);
    }

    /**
     * Returns the set headers by wire name, in a stable order.
     */
    public Map<String, String> asMap() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (clientId != null) {
            headers.put("Client-Id", clientId);
        }
        if (apiVersion != null) {
            headers.put("Stripe-Version", apiVersion);
        }
        if (account != null) {
            headers.put("Stripe-Account", account);
        }
        return headers;
    }
}
