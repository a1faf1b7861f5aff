package com.example.payments.model;

/**
 * A time span in epoch seconds. Either end may be open.
 */
public record Period(Long start, Long end) {
}
