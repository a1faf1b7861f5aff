package com.example.payments.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param invoiceNow invoice pending metered usage and prorations immediately
 * @param prorate create prorations for the unused remainder of the period
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelSubscriptionSchedule(
        @JsonProperty("invoice_now") Boolean invoiceNow,
        Boolean prorate
) {
    public static CancelSubscriptionSchedule create() {
        return new CancelSubscriptionSchedule(null, null);
    }
}
