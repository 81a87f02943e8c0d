package com.dropship.checkout.core.reconcile;

import com.dropship.checkout.compliance.OrderAuditLogger;
import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.dropship.checkout.messaging.OrderEventProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderReconcilerTest {

    @Mock
    private OrderLedger ledger;
    @Mock
    private OrderAuditLogger auditLogger;
    @Mock
    private OrderEventProducer eventProducer;

    private OrderReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new OrderReconciler(ledger, auditLogger, eventProducer);
    }

    @Test
    void successfulPollMarksPendingOrderPaidAndPublishes() {
        Order paid = order(OrderStatus.PAID);
        when(ledger.findByReference("ref_1")).thenReturn(Optional.of(order(OrderStatus.PENDING)), Optional.of(paid));
        when(ledger.transition("ref_1", OrderStatus.PAID)).thenReturn(true);

        assertThat(reconciler.apply("ref_1", poll(true))).isTrue();

        verify(auditLogger).logTransition("ref_1", OrderStatus.PAID, "poll", true);
        verify(eventProducer).publishTransition(paid, "poll");
    }

    @Test
    void failedWebhookMarksOrderFailed() {
        when(ledger.findByReference("ref_1")).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(ledger.transition("ref_1", OrderStatus.FAILED)).thenReturn(true);

        assertThat(reconciler.apply("ref_1", new WebhookEvent("evt_1", WebhookEvent.PAYMENT_FAILED, "ref_1"))).isTrue();

        verify(ledger).transition("ref_1", OrderStatus.FAILED);
    }

    @Test
    void unknownOrderIsIgnored() {
        when(ledger.findByReference("ref_1")).thenReturn(Optional.empty());

        assertThat(reconciler.apply("ref_1", poll(true))).isFalse();

        verify(ledger, never()).transition(anyString(), any());
        verifyNoInteractions(eventProducer, auditLogger);
    }

    @Test
    void terminalOrderIsNotTouched() {
        when(ledger.findByReference("ref_1")).thenReturn(Optional.of(order(OrderStatus.FAILED)));

        assertThat(reconciler.apply("ref_1", poll(true))).isFalse();

        verify(ledger, never()).transition(anyString(), any());
    }

    @Test
    void lostRaceIsAuditedButNotPublished() {
        when(ledger.findByReference("ref_1")).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(ledger.transition("ref_1", OrderStatus.PAID)).thenReturn(false);

        assertThat(reconciler.apply("ref_1", poll(true))).isFalse();

        verify(auditLogger).logTransition("ref_1", OrderStatus.PAID, "poll", false);
        verifyNoInteractions(eventProducer);
    }

    @Test
    void noConfirmationLeavesOrderPending() {
        when(ledger.findByReference("opay_ref_1")).thenReturn(Optional.of(order(OrderStatus.PENDING)));

        assertThat(reconciler.apply("opay_ref_1", new NoConfirmation("opay_ref_1"))).isFalse();

        verify(ledger, never()).transition(anyString(), any());
    }

    private static PollResult poll(boolean succeeded) {
        return PollResult.builder()
                .paymentReference("ref_1")
                .gateway(GatewayType.PAYSTACK)
                .succeeded(succeeded)
                .gatewayStatus(succeeded ? "success" : "failed")
                .build();
    }

    private static Order order(OrderStatus status) {
        return Order.builder()
                .localOrderId("o1-1000")
                .paymentReference("ref_1")
                .status(status)
                .gateway(GatewayType.PAYSTACK)
                .customer(Customer.empty())
                .itemsJson("[]")
                .build();
    }
}
