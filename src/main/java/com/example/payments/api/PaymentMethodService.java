package com.example.payments.api;

import com.example.payments.client.ApiObjectMapper;
import com.example.payments.client.ApiTransport;
import com.example.payments.model.Page;
import com.example.payments.model.PaymentMethod;
import com.example.payments.params.AttachPaymentMethod;
import com.example.payments.params.ListPaymentMethods;
import com.fasterxml.jackson.databind.JavaType;

import java.util.concurrent.CompletableFuture;

/**
 * Payment method operations.
 */
public class PaymentMethodService extends ApiService {

    private static final JavaType PAYMENT_METHOD = ApiObjectMapper.typeOf(PaymentMethod.class);
    private static final JavaType PAYMENT_METHOD_PAGE = Page.typeOf(PaymentMethod.class);

    public PaymentMethodService(ApiTransport transport) {
        super(transport);
    }

    public CompletableFuture<Page<PaymentMethod>> list(ListPaymentMethods params) {
        return list("/payment_methods", params, PAYMENT_METHOD_PAGE);
    }

    /**
     * Attaches a payment method to a customer.
     */
    public CompletableFuture<PaymentMethod> attach(String paymentMethodId, AttachPaymentMethod params) {
        return transport.postForm("/payment_methods/" + segment(paymentMethodId) + "/attach", params, PAYMENT_METHOD);
    }

    /**
     * Detaches a payment method from its customer. It can no longer be used afterwards.
     */
    public CompletableFuture<PaymentMethod> detach(String paymentMethodId) {
        return transport.post("/payment_methods/" + segment(paymentMethodId) + "/detach", PAYMENT_METHOD);
    }
}
