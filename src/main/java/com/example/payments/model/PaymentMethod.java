package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * A payment instrument, optionally attached to a customer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentMethod(
        String id,
        String object,
        String type,
        long created,
        Expandable<Customer> customer,
        boolean livemode,
        Map<String, String> metadata
) implements ApiResource {
}
