package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.domain.OrderStatus;

import java.util.Optional;

/**
 * Order status transitions. Only {@code pending -> paid} and {@code pending -> failed} exist;
 * terminal states absorb every later signal.
 */
public final class OrderStateMachine {

    private OrderStateMachine() {
    }

    public static Optional<OrderStatus> next(OrderStatus current, ConfirmationSignal signal) {
        if (current == null || current.isTerminal()) {
            return Optional.empty();
        }
        return signal.targetStatus().filter(OrderStatus::isTerminal);
    }
}
