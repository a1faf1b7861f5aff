package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Usage of a subscription item summed over one billing period.
 *
 * <p>Summaries are listed newest first; the first one covers the current,
 * still open period and may change until that period ends.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageRecordSummary(
        String id,
        String object,
        String invoice,
        Period period,
        @JsonProperty("subscription_item") String subscriptionItem,
        @JsonProperty("total_usage") long totalUsage,
        boolean livemode
) implements ApiResource {
}
