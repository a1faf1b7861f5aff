package com.example.payments.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param preserveCancelDate keep the subscription's scheduled cancellation after release
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReleaseSubscriptionSchedule(
        @JsonProperty("preserve_cancel_date") Boolean preserveCancelDate
) {
    public static ReleaseSubscriptionSchedule create() {
        return new ReleaseSubscriptionSchedule(null);
    }
}
