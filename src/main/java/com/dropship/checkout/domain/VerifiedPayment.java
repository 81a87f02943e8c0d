package com.dropship.checkout.domain;

import lombok.Value;

import java.util.Map;

/**
 * A payment the gateway confirmed on a verify call.
 */
@Value
public class VerifiedPayment {

    /** Ledger order for the reference; null when the ledger has no record of it. */
    Order order;
    Map<String, Object> transaction;
}
