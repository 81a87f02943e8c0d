package com.dropship.checkout.domain;

/**
 * Payment gateways the checkout can route to. Each value is served by exactly one
 * {@link com.dropship.checkout.core.GatewayAdapter}.
 */
public enum GatewayType {
    /** Card rail with a hosted, redirect-based checkout page. */
    PAYSTACK,
    /** Mobile-money rail; invoices are signed with HMAC-SHA512. */
    OPAY,
    /** Marketplace split through a payment intent and a connected supplier account. */
    STRIPE
}
