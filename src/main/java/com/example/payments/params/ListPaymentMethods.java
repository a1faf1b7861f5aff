package com.example.payments.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Filters for listing payment methods.
 *
 * @param customer only return payment methods attached to this customer
 * @param type only return payment methods of this type, e.g. {@code card}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListPaymentMethods(
        String customer,
        String type,
        Integer limit,
        @JsonProperty("starting_after") String startingAfter,
        @JsonProperty("ending_before") String endingBefore,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> expand
) implements ListParams {

    public static ListPaymentMethods forCustomer(String customer) {
        return new ListPaymentMethods(customer, null, null, null, null, List.of());
    }

    public ListPaymentMethods withType(String type) {
        return new ListPaymentMethods(customer, type, limit, startingAfter, endingBefore, expand);
    }

    public ListPaymentMethods withLimit(int limit) {
        return new ListPaymentMethods(customer, type, limit, startingAfter, endingBefore, expand);
    }

    public ListPaymentMethods withExpand(String... fields) {
        return new ListPaymentMethods(customer, type, limit, startingAfter, endingBefore, List.of(fields));
    }

    @Override
    public ListPaymentMethods withoutCursors() {
        return new ListPaymentMethods(customer, type, limit, null, null, expand);
    }
}
