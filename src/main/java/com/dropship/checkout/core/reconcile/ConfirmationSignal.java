package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.domain.OrderStatus;

import java.util.Optional;

/**
 * A confirmation about one payment, from whichever channel produced it. The three
 * implementations ({@link PollResult}, {@link WebhookEvent}, {@link NoConfirmation}) keep
 * protocol parsing out of {@link OrderStateMachine}.
 */
public interface ConfirmationSignal {

    String getPaymentReference();

    /**
     * Status this signal asks for, or empty if it does not ask for a change.
     */
    Optional<OrderStatus> targetStatus();

    /** Short channel name for logs and audit lines. */
    String channel();
}
