package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Controls the label of the checkout submit button.
 */
public enum CheckoutSessionSubmitType {
    @JsonProperty("auto")
    AUTO,
    @JsonProperty("book")
    BOOK,
    @JsonProperty("donate")
    DONATE,
    @JsonProperty("pay")
    PAY
}
