package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A short-lived session of the customer portal. Customers manage their
 * subscriptions and billing details by visiting {@link #url()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BillingPortalSession(
        String id,
        String object,
        long created,
        String customer,
        String configuration,
        boolean livemode,
        @JsonProperty("return_url") String returnUrl,
        String url
) implements ApiResource {
}
