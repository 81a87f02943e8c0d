package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a synchronous verify call. A poll that does not report success asks for no
 * change: the order stays pending and can be verified again.
 */
@Value
@Builder
public class PollResult implements ConfirmationSignal {

    String paymentReference;
    GatewayType gateway;
    boolean succeeded;
    /** Gateway's own status string, e.g. "success", "abandoned", "succeeded". */
    String gatewayStatus;
    /** Gateway transaction payload, returned to the caller as-is. */
    Map<String, Object> transaction;

    @Override
    public Optional<OrderStatus> targetStatus() {
        return succeeded ? Optional.of(OrderStatus.PAID) : Optional.empty();
    }

    @Override
    public String channel() {
        return "poll";
    }
}
