package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Open or closed bounds of a {@link RangeQuery}. Unset bounds are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangeBounds<T>(T gt, T gte, T lt, T lte) {
}
