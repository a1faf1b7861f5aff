package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.Page;
import com.example.payments.model.Subscription;
import com.example.payments.params.ListSubscriptions;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

/**
 * Subscription operations.
 */
public class SubscriptionService extends ApiService {

    private static final JavaType SUBSCRIPTION = ApiObjectMapper.typeOf(Subscription.class);
    private static final JavaType SUBSCRIPTION_PAGE = Page.typeOf(Subscription.class);

    public SubscriptionService(ApiTransport transport) {
        super(transport);
    }

    /**
     * Lists subscriptions, newest first.
     */
    public CompletableFuture<Page<Subscription>> list(ListSubscriptions params) {
        return list("/subscriptions", params, SUBSCRIPTION_PAGE);
    }

    /**
     * Cancels a subscription immediately.
     */
    public CompletableFuture<Subscription> cancel(String subscriptionId) {
        return transport.delete("/subscriptions/" + segment(subscriptionId), SUBSCRIPTION);
    }
}
