package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result handed back to the caller after a checkout was started.
 */
@Value
@Builder
public class CheckoutResult {

    GatewayInitiation initiation;
    /** Local order id, or null when the gateway path creates the order later. */
    String localOrderId;
}
