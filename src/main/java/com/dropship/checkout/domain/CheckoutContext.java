package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything an adapter needs to initiate a payment. Totals are already validated.
 */
@Value
@Builder
public class CheckoutContext {

    List<CartItem> items;
    Customer customer;
    ProfitSplit split;
    /** Shipping fee in kobo for the customer's region. */
    long shippingFeeMinor;
    /** ISO currency for intent-based gateways, lower case. */
    @Builder.Default
    String currency = "usd";
}
