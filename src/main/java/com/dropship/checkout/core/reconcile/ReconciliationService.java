package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.api.PaymentNotConfirmedException;
import com.dropship.checkout.api.ValidationException;
import com.dropship.checkout.core.GatewayAdapter;
import com.dropship.checkout.core.GatewayRegistry;
import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.VerifiedPayment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Poll-and-verify confirmation: asks the gateway about a reference and settles the order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final GatewayRegistry gatewayRegistry;
    private final OrderReconciler reconciler;
    private final OrderLedger ledger;

    /**
     * Marks the order paid if the gateway reports success. Any other gateway status leaves the
     * order pending and raises {@link PaymentNotConfirmedException}.
     */
    public VerifiedPayment verifyPayment(GatewayType gateway, String reference) {
        if (reference == null || reference.isBlank()) {
            throw new ValidationException("Reference required");
        }
        GatewayAdapter adapter = gatewayRegistry.adapterFor(gateway);
        PollResult poll = gatewayRegistry.invoke(adapter, () -> adapter.verify(reference))
                .orElseThrow(() -> new ValidationException(gateway + " does not support payment verification"));

        if (!poll.isSucceeded()) {
            log.warn("Payment not successful: gateway={}, reference={}, gatewayStatus={}",
                    gateway, reference, poll.getGatewayStatus());
            throw new PaymentNotConfirmedException("Payment failed");
        }
        reconciler.apply(reference, poll);
        return new VerifiedPayment(ledger.findByReference(reference).orElse(null), poll.getTransaction());
    }
}
