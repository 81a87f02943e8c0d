package com.dropship.checkout.core;

import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of orders keyed by payment reference.
 * <p>
 * Implementations guarantee at most one order per payment reference, even under concurrent
 * writers, and only move an order out of {@code pending} once. Storage failures surface as
 * {@link com.dropship.checkout.api.LedgerPersistenceException}.
 */
public interface OrderLedger {

    /**
     * Records a pending order for the draft. If an order already exists for the same payment
     * reference, nothing is written and the existing local order id is returned.
     *
     * @return local order id of the (new or existing) order
     */
    String createDraft(DraftOrder draft);

    /**
     * Moves the order from {@code pending} to {@code target}.
     *
     * @return true if this call changed the order; false if the order is unknown or already
     *         terminal
     */
    boolean transition(String paymentReference, OrderStatus target);

    default boolean markPaid(String paymentReference) {
        return transition(paymentReference, OrderStatus.PAID);
    }

    default boolean markFailed(String paymentReference) {
        return transition(paymentReference, OrderStatus.FAILED);
    }

    Optional<Order> findByReference(String paymentReference);

    /** All orders, newest first. */
    List<Order> listOrders();
}
