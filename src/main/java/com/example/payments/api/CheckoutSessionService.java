package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.CheckoutSession;
import com.example.payments.params.CreateCheckoutSession;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

public class CheckoutSessionService extends ApiService {

    private static final JavaType SESSION = ApiObjectMapper.typeOf(CheckoutSession.class);

    public CheckoutSessionService(ApiTransport transport) {
        super(transport);
    }

    public CompletableFuture<CheckoutSession> create(CreateCheckoutSession params) {
        return transport.postForm("/checkout/sessions", params, SESSION);
    }
}
