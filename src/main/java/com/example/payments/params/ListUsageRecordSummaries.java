package com.example.payments.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Filters for listing the usage record summaries of a subscription item.
 * The subscription item itself is part of the URL, not of these parameters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListUsageRecordSummaries(
        @JsonProperty("ending_before") String endingBefore,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> expand,
        Integer limit,
        @JsonProperty("starting_after") String startingAfter
) implements ListParams {

    public static ListUsageRecordSummaries create() {
        return new ListUsageRecordSummaries(null, List.of(), null, null);
    }

    /**
     * @param limit page size, between 1 and 100; the server defaults to 10
     */
    public ListUsageRecordSummaries withLimit(int limit) {
        return new ListUsageRecordSummaries(endingBefore, expand, limit, startingAfter);
    }

    public ListUsageRecordSummaries withExpand(String... fields) {
        return new ListUsageRecordSummaries(endingBefore, List.of(fields), limit, startingAfter);
    }

    public ListUsageRecordSummaries withStartingAfter(String cursor) {
        return new ListUsageRecordSummaries(endingBefore, expand, limit, cursor);
    }

    public ListUsageRecordSummaries withEndingBefore(String cursor) {
        return new ListUsageRecordSummaries(cursor, expand, limit, startingAfter);
    }

    @Override
    public ListUsageRecordSummaries withoutCursors() {
        return new ListUsageRecordSummaries(null, expand, limit, null);
    }
}
