package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.domain.OrderStatus;
import lombok.Value;

import java.util.Optional;

/**
 * A gateway-pushed event, already parsed (and verified when a signing secret is configured).
 */
@Value
public class WebhookEvent implements ConfirmationSignal {

    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_FAILED = "payment_intent.payment_failed";

    String eventId;
    String type;
    /** Payment intent id carried in {@code data.object.id}. */
    String paymentReference;

    public boolean isRecognized() {
        return PAYMENT_SUCCEEDED.equals(type) || PAYMENT_FAILED.equals(type);
    }

    @Override
    public Optional<OrderStatus> targetStatus() {
        if (PAYMENT_SUCCEEDED.equals(type)) {
            return Optional.of(OrderStatus.PAID);
        }
        if (PAYMENT_FAILED.equals(type)) {
            return Optional.of(OrderStatus.FAILED);
        }
        return Optional.empty();
    }

    @Override
    public String channel() {
        return "webhook";
    }
}
