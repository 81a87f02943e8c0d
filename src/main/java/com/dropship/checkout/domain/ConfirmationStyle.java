package com.dropship.checkout.domain;

/**
 * How a gateway tells us that a payment went through.
 */
public enum ConfirmationStyle {
    /** We call the gateway's verify endpoint with the payment reference. */
    POLL,
    /** The gateway pushes a signed event to /webhook. */
    WEBHOOK,
    /** Nothing ever calls back; orders stay pending until reconciled by hand. */
    NONE
}
