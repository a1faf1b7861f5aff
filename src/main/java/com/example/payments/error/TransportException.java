package com.example.payments.error;

/**
 * Wraps any failure of the HTTP collaborator: an error status, a network
 * failure, a timeout or an interrupted request.
 */
public class TransportException extends PaymentApiException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final ApiError apiError;

    public TransportException(int statusCode, ApiError apiError, String message) {
        super(message);
        this.statusCode = statusCode;
        this.apiError = apiError;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.apiError = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the decoded error body, or {@code null} when the response
     * carried none or there was no response at all.
     */
    public ApiError getApiError() {
        return apiError;
    }
}
