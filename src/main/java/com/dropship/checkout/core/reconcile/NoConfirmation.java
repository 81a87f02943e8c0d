package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.domain.OrderStatus;
import lombok.Value;

import java.util.Optional;

/**
 * Marker for gateways that never call back. Applying it changes nothing: such orders stay
 * pending until someone reconciles them outside this service.
 */
@Value
public class NoConfirmation implements ConfirmationSignal {

    String paymentReference;

    @Override
    public Optional<OrderStatus> targetStatus() {
        return Optional.empty();
    }

    @Override
    public String channel() {
        return "none";
    }
}
