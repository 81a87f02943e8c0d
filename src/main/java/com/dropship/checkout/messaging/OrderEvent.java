package com.dropship.checkout.messaging;

import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.OrderStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Order lifecycle event published to Kafka. Carries amounts and ids only; customer contact
 * details stay in the ledger.
 */
@Value
@Builder
@Jacksonized
public class OrderEvent {

    public static final String DRAFT_CREATED = "ORDER_DRAFT_CREATED";
    public static final String PAID = "ORDER_PAID";
    public static final String FAILED = "ORDER_FAILED";

    String eventId;
    /** ORDER_DRAFT_CREATED, ORDER_PAID or ORDER_FAILED */
    String eventType;
    String paymentReference;
    String localOrderId;
    GatewayType gateway;
    OrderStatus status;
    long totalMinorUsd;
    long totalMinorNgn;
    long supplierShareMinor;
    long profitMinor;
    /** poll, webhook, checkout */
    String channel;
    Instant timestamp;
}
