package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An order as recorded in the ledger.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    String localOrderId;
    String paymentReference;
    OrderStatus status;
    GatewayType gateway;
    Customer customer;
    /** JSON snapshot of the cart taken at draft time. */
    String itemsJson;
    long totalMinorUsd;
    long totalMinorNgn;
    long supplierShareMinor;
    long profitMinor;
    String supplierResponse;
    String gatewayResponse;
    Instant createdAt;
    Instant processedAt;
}
