package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.compliance.OrderAuditLogger;
import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.dropship.checkout.messaging.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Applies a confirmation signal to the ledger. The state machine decides the target; the
 * ledger's conditional update decides who wins when two signals race.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderReconciler {

    private final OrderLedger ledger;
    private final OrderAuditLogger auditLogger;
    private final OrderEventProducer eventProducer;

    /**
     * @return true if the order changed status
     */
    public boolean apply(String paymentReference, ConfirmationSignal signal) {
        Optional<Order> current = ledger.findByReference(paymentReference);
        if (current.isEmpty()) {
            log.info("{} signal for unknown reference={}, nothing to update", signal.channel(), paymentReference);
            return false;
        }
        Optional<OrderStatus> target = OrderStateMachine.next(current.get().getStatus(), signal);
        if (target.isEmpty()) {
            log.info("{} signal leaves order reference={} in status {}",
                    signal.channel(), paymentReference, current.get().getStatus());
            return false;
        }

        boolean applied = ledger.transition(paymentReference, target.get());
        auditLogger.logTransition(paymentReference, target.get(), signal.channel(), applied);
        if (applied) {
            ledger.findByReference(paymentReference)
                    .ifPresent(order -> eventProducer.publishTransition(order, signal.channel()));
        }
        return applied;
    }
}
