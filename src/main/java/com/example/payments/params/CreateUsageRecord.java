package com.example.payments.params;

import com.example.payments.model.UsageRecordAction;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Parameters for reporting usage of a metered subscription item.
 *
 * @param quantity the usage quantity for the timestamp
 * @param timestamp when the usage occurred, in epoch seconds
 * @param action how to combine with existing usage; {@code null} means increment
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateUsageRecord(
        long quantity,
        long timestamp,
        UsageRecordAction action
) {
    public static CreateUsageRecord of(long quantity, long timestamp) {
        return new CreateUsageRecord(quantity, timestamp, null);
    }

    public CreateUsageRecord withAction(UsageRecordAction action) {
        return new CreateUsageRecord(quantity, timestamp, action);
    }
}
