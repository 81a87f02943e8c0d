package com.dropship.checkout.messaging;

import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle events, keyed by payment reference so all events of one order land
 * on the same partition. Publishing is best effort: a broker outage is logged and never fails
 * the checkout or the confirmation that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    private final KafkaTemplate<String, OrderEvent> kafkaTemplate;
    private final CheckoutProperties properties;
    private final Clock clock;

    public void publishDraftCreated(DraftOrder draft, String localOrderId) {
        OrderEvent event = OrderEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(OrderEvent.DRAFT_CREATED)
                .paymentReference(draft.getPaymentReference())
                .localOrderId(localOrderId)
                .gateway(draft.getGateway())
                .status(OrderStatus.PENDING)
                .totalMinorUsd(draft.getTotalMinorUsd())
                .totalMinorNgn(draft.getTotalMinorNgn())
                .supplierShareMinor(draft.getSupplierShareMinor())
                .profitMinor(draft.getProfitMinor())
                .channel("checkout")
                .timestamp(clock.instant())
                .build();
        send(event);
    }

    public void publishTransition(Order order, String channel) {
        OrderEvent event = OrderEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(order.getStatus() == OrderStatus.PAID ? OrderEvent.PAID : OrderEvent.FAILED)
                .paymentReference(order.getPaymentReference())
                .localOrderId(order.getLocalOrderId())
                .gateway(order.getGateway())
                .status(order.getStatus())
                .totalMinorUsd(order.getTotalMinorUsd())
                .totalMinorNgn(order.getTotalMinorNgn())
                .supplierShareMinor(order.getSupplierShareMinor())
                .profitMinor(order.getProfitMinor())
                .channel(channel)
                .timestamp(order.getProcessedAt() != null ? order.getProcessedAt() : clock.instant())
                .build();
        send(event);
    }

    private void send(OrderEvent event) {
        if (!properties.getEvents().isEnabled()) {
            log.debug("Order events disabled, not publishing {} for reference={}",
                    event.getEventType(), event.getPaymentReference());
            return;
        }
        String key = event.getPaymentReference();
        log.info("Publishing order event: key={}, eventId={}, eventType={}", key, event.getEventId(), event.getEventType());
        CompletableFuture<SendResult<String, OrderEvent>> future;
        try {
            future = kafkaTemplate.send(properties.getEvents().getTopic(), key, event);
        } catch (KafkaException | org.apache.kafka.common.KafkaException e) {
            log.error("Failed to hand order event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish order event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published order event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
