package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CheckoutSessionMode {
    @JsonProperty("payment")
    PAYMENT,
    @JsonProperty("setup")
    SETUP,
    @JsonProperty("subscription")
    SUBSCRIPTION
}
