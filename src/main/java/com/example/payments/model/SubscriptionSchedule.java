package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A schedule of phases that drives changes to a subscription over time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionSchedule(
        String id,
        String object,
        String status,
        String customer,
        String subscription,
        long created,
        @JsonProperty("released_at") Long releasedAt,
        @JsonProperty("released_subscription") String releasedSubscription,
        @JsonProperty("canceled_at") Long canceledAt
) implements ApiResource {
}
