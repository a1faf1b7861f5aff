package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A hosted payment page session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckoutSession(
        String id,
        String object,
        String url,
        CheckoutSessionMode mode,
        String customer,
        @JsonProperty("customer_email") String customerEmail,
        @JsonProperty("client_reference_id") String clientReferenceId,
        @JsonProperty("payment_status") String paymentStatus,
        String status,
        @JsonProperty("success_url") String successUrl,
        @JsonProperty("cancel_url") String cancelUrl,
        boolean livemode
) implements ApiResource {
}
