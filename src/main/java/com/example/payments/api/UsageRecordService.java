package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.Page;
import com.example.payments.model.UsageRecord;
import com.example.payments.model.UsageRecordSummary;
import com.example.payments.params.CreateUsageRecord;
import com.example.payments.params.ListUsageRecordSummaries;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

/**
 * Usage reporting for metered subscription items.
 */
public class UsageRecordService extends ApiService {

    private static final JavaType USAGE_RECORD = ApiObjectMapper.typeOf(UsageRecord.class);
    private static final JavaType SUMMARY_PAGE = Page.typeOf(UsageRecordSummary.class);

    public UsageRecordService(ApiTransport transport) {
        super(transport);
    }

    /**
     * Reports usage of a subscription item at a point in time.
     */
    public CompletableFuture<UsageRecord> create(String subscriptionItemId, CreateUsageRecord params) {
        return transport.postForm(
                "/subscription_items/" + segment(subscriptionItemId) + "/usage_records",
                params,
                USAGE_RECORD
        );
    }

    /**
     * Lists the per-period usage summaries of a subscription item, newest
     * period first. The first summary covers the open period and may still change.
     */
    public CompletableFuture<Page<UsageRecordSummary>> listSummaries(
            String subscriptionItemId,
            ListUsageRecordSummaries params
    ) {
        return list(
                "/subscription_items/" + segment(subscriptionItemId) + "/usage_record_summaries",
                params,
                SUMMARY_PAGE
        );
    }
}
