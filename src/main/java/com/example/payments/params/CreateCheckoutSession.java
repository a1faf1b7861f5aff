package com.example.payments.params;

import com.example.payments.model.CheckoutSessionMode;
import com.example.payments.model.CheckoutSessionSubmitType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters for creating a hosted checkout session.
 *
 * <p>Example usage:
 * <pre>{@code
 * CreateCheckoutSession params = CreateCheckoutSession.builder(
 *             "https://example.com/success", "https://example.com/cancel")
 *         .paymentMethodTypes("card")
 *         .mode(CheckoutSessionMode.PAYMENT)
 *         .lineItem(LineItem.of(2000, "usd", "T-shirt", 1))
 *         .build();
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateCheckoutSession(
        @JsonProperty("success_url") String successUrl,
        @JsonProperty("cancel_url") String cancelUrl,
        @JsonProperty("payment_method_types") List<String> paymentMethodTypes,
        @JsonProperty("client_reference_id") String clientReferenceId,
        String customer,
        @JsonProperty("customer_email") String customerEmail,
        @JsonProperty("billing_address_collection") String billingAddressCollection,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("line_items") List<LineItem> lineItems,
        String locale,
        CheckoutSessionMode mode,
        @JsonProperty("submit_type") CheckoutSessionSubmitType submitType
) {

    public static Builder builder(String successUrl, String cancelUrl) {
        return new Builder(successUrl, cancelUrl);
    }

    /**
     * An ad-hoc item purchased in the session.
     *
     * @param amount price per unit, in the currency's smallest unit
     * @param currency three-letter ISO currency code, lowercase
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LineItem(
            long amount,
            String currency,
            String name,
            long quantity,
            String description,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> images
    ) {
        public static LineItem of(long amount, String currency, String name, long quantity) {
            return new LineItem(amount, currency, name, quantity, null, List.of());
        }
    }

    public static final class Builder {

        private final String successUrl;
        private final String cancelUrl;
        private final List<String> paymentMethodTypes = new ArrayList<>();
        private final List<LineItem> lineItems = new ArrayList<>();
        private String clientReferenceId;
        private String customer;
        private String customerEmail;
        private String billingAddressCollection;
        private String locale;
        private CheckoutSessionMode mode;
        private CheckoutSessionSubmitType submitType;

        private Builder(String successUrl, String cancelUrl) {
            this.successUrl = Objects.requireNonNull(successUrl, "successUrl must not be null");
            this.cancelUrl = Objects.requireNonNull(cancelUrl, "cancelUrl must not be null");
        }

        public Builder paymentMethodTypes(String... types) {
            paymentMethodTypes.addAll(List.of(types));
            return this;
        }

        /**
         * A reference to reconcile the session with internal systems, such as a cart id.
         */
        public Builder clientReferenceId(String clientReferenceId) {
            this.clientReferenceId = clientReferenceId;
            return this;
        }

        public Builder customer(String customer) {
            this.customer = customer;
            return this;
        }

        public Builder customerEmail(String customerEmail) {
            this.customerEmail = customerEmail;
            return this;
        }

        /**
         * {@code auto} or {@code required}.
         */
        public Builder billingAddressCollection(String billingAddressCollection) {
            this.billingAddressCollection = billingAddressCollection;
            return this;
        }

        public Builder lineItem(LineItem lineItem) {
            lineItems.add(lineItem);
            return this;
        }

        /**
         * IETF language tag of the page; {@code auto} or unset uses the browser's locale.
         */
        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder mode(CheckoutSessionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder submitType(CheckoutSessionSubmitType submitType) {
            this.submitType = submitType;
            return this;
        }

        public CreateCheckoutSession build() {
            return new CreateCheckoutSession(
                    successUrl,
                    cancelUrl,
                    List.copyOf(paymentMethodTypes),
                    clientReferenceId,
                    customer,
                    customerEmail,
                    billingAddressCollection,
                    List.copyOf(lineItems),
                    locale,
                    mode,
                    submitType
            );
        }
    }
}
