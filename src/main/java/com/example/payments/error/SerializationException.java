package com.example.payments.error;

/**
 * Failure to encode request parameters or decode a response body.
 */
public class SerializationException extends PaymentApiException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
