package com.example.payments.error;

/**
 * Thrown when the server returns an empty page that still claims more data.
 */
public class PaginationProtocolException extends PaymentApiException {

    private final String url;

    public PaginationProtocolException(String url) {
        super("Empty page reports has_more=true: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
