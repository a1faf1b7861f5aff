package com.example.payments.error;

/**
 * Thrown when a page's stored URL was issued under a different API version
 * than the one the client is configured for.
 */
public class UnsupportedVersionException extends PaymentApiException {

    private final String url;
    private final String expectedPrefix;

    public UnsupportedVersionException(String url, String expectedPrefix) {
        super("URL for fetching additional data uses different API version: "
                + url + " (expected prefix " + expectedPrefix + ")");
        this.url = url;
        this.expectedPrefix = expectedPrefix;
    }

    public String getUrl() {
        return url;
    }

    public String getExpectedPrefix() {
        return expectedPrefix;
    }
}
