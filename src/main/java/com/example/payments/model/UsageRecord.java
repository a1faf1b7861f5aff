package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A quantity of usage reported against a metered subscription item.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageRecord(
        String id,
        String object,
        long quantity,
        @JsonProperty("subscription_item") String subscriptionItem,
        long timestamp,
        boolean livemode
) implements ApiResource {
}
