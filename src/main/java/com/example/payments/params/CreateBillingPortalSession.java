package com.example.payments.params;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Parameters for opening a customer portal session.
 *
 * @param customer the id of an existing customer
 * @param returnUrl where customers go when they leave the portal; required
 *                  unless the portal configuration defines a default
 * @param configuration the portal configuration to use; the default one when {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateBillingPortalSession(
        String customer,
        @JsonProperty("return_url") String returnUrl,
        String configuration
) {
    public CreateBillingPortalSession {
        Objects.requireNonNull(customer, "customer must not be null");
    }

    public static CreateBillingPortalSession forCustomer(String customer) {
        return new CreateBillingPortalSession(customer, null, null);
    }

    public CreateBillingPortalSession withReturnUrl(String returnUrl) {
        return new CreateBillingPortalSession(customer, returnUrl, configuration);
    }

    public CreateBillingPortalSession withConfiguration(String configuration) {
        return new CreateBillingPortalSession(customer, returnUrl, configuration);
    }
}
