package com.example.payments.params;

/**
 * @param customer the customer to attach the payment method to
 */
public record AttachPaymentMethod(String customer) {
}
