package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.SubscriptionSchedule;
import com.example.payments.params.CancelSubscriptionSchedule;
import com.example.payments.params.ReleaseSubscriptionSchedule;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

public class SubscriptionScheduleService extends ApiService {

    private static final JavaType SCHEDULE = ApiObjectMapper.typeOf(SubscriptionSchedule.class);

    public SubscriptionScheduleService(ApiTransport transport) {
        super(transport);
    }

    /**
     * Cancels a schedule and the subscription it manages.
     */
    public CompletableFuture<SubscriptionSchedule> cancel(String scheduleId, CancelSubscriptionSchedule params) {
        return transport.postForm("/subscription_schedules/" + segment(scheduleId) + "/cancel", params, SCHEDULE);
    }

    /**
     * Releases a schedule; the subscription it manages stays in place.
     */
    public CompletableFuture<SubscriptionSchedule> release(String scheduleId, ReleaseSubscriptionSchedule params) {
        return transport.postForm("/subscription_schedules/" + segment(scheduleId) + "/release", params, SCHEDULE);
    }
}
