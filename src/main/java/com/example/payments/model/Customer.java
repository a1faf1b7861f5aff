package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The subset of a customer object that is returned when a reference to it is expanded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Customer(
        String id,
        String object,
        String email,
        String name,
        long created
) implements ApiResource {
}
