package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.BillingPortalSession;
import com.example.payments.params.CreateBillingPortalSession;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

public class BillingPortalSessionService extends ApiService {

    private static final JavaType SESSION = ApiObjectMapper.typeOf(BillingPortalSession.class);

    public BillingPortalSessionService(ApiTransport transport) {
        super(transport);
    }

    /**
     * Opens a customer portal session. Redirect the customer to the returned session's url.
     */
    public CompletableFuture<BillingPortalSession> create(CreateBillingPortalSession params) {
        return transport.postForm("/billing_portal/sessions", params, SESSION);
    }
}
