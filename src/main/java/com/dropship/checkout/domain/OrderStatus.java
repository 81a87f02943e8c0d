package com.dropship.checkout.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Order lifecycle. {@link #PENDING} is the only non-terminal state; an order moves
 * forward to {@link #PAID} or {@link #FAILED} exactly once.
 */
public enum OrderStatus {
    PENDING,
    PAID,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
