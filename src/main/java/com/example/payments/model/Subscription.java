package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A recurring charge for a customer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Subscription(
        String id,
        String object,
        String status,
        Expandable<Customer> customer,
        long created,
        @JsonProperty("cancel_at_period_end") boolean cancelAtPeriodEnd,
        @JsonProperty("canceled_at") Long canceledAt,
        @JsonProperty("current_period_start") Long currentPeriodStart,
        @JsonProperty("current_period_end") Long currentPeriodEnd,
        boolean livemode,
        Map<String, String> metadata
) implements ApiResource {
}
