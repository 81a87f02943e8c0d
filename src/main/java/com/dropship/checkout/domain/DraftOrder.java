package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Canonical draft produced by a gateway adapter once the gateway has accepted a payment
 * initiation. The ledger turns it into a {@code pending} order.
 */
@Value
@Builder
public class DraftOrder {

    String paymentReference;
    GatewayType gateway;
    Customer customer;
    List<CartItem> items;
    long totalMinorUsd;
    long totalMinorNgn;
    long supplierShareMinor;
    long profitMinor;
    /** Raw provider response, kept for paths that never parse it. */
    String gatewayResponse;
}
