package com.example.payments.error;

/**
 * Base type for every failure surfaced by the client.
 *
 * <p>The client never recovers locally: transport, serialization and
 * pagination failures are all reported to the immediate caller as a
 * subclass of this exception.
 */
public class PaymentApiException extends RuntimeException {

    public PaymentApiException(String message) {
        super(message);
    }

    public PaymentApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
