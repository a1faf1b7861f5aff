package com.example.payments.params;

import com.example.payments.model.RangeQuery;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Filters for listing subscriptions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListSubscriptions(
        String customer,
        String status,
        RangeQuery<Long> created,
        Integer limit,
        @JsonProperty("starting_after") String startingAfter,
        @JsonProperty("ending_before") String endingBefore,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> expand
) implements ListParams {

    public static ListSubscriptions create() {
        return new ListSubscriptions(null, null, null, null, null, null, List.of());
    }

    public ListSubscriptions withCustomer(String customer) {
        return new ListSubscriptions(customer, status, created, limit, startingAfter, endingBefore, expand);
    }

    public ListSubscriptions withStatus(String status) {
        return new ListSubscriptions(customer, status, created, limit, startingAfter, endingBefore, expand);
    }

    public ListSubscriptions withCreated(RangeQuery<Long> created) {
        return new ListSubscriptions(customer, status, created, limit, startingAfter, endingBefore, expand);
    }

    public ListSubscriptions withLimit(int limit) {
        return new ListSubscriptions(customer, status, created, limit, startingAfter, endingBefore, expand);
    }

    public ListSubscriptions withStartingAfter(String cursor) {
        return new ListSubscriptions(customer, status, created, limit, cursor, endingBefore, expand);
    }

    public ListSubscriptions withExpand(String... fields) {
        return new ListSubscriptions(customer, status, created, limit, startingAfter, endingBefore, List.of(fields));
    }

    @Override
    public ListSubscriptions withoutCursors() {
        return new ListSubscriptions(customer, status, created, limit, null, null, expand);
    }
}
