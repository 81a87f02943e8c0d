package com.dropship.checkout.messaging;

import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderEventProducerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Mock
    private KafkaTemplate<String, OrderEvent> kafkaTemplate;

    private CheckoutProperties properties;
    private OrderEventProducer producer;

    @BeforeEach
    void setUp() {
        properties = new CheckoutProperties();
        producer = new OrderEventProducer(kafkaTemplate, properties, CLOCK);
    }

    @Test
    void draftEventIsKeyedByPaymentReference() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenReturn(new CompletableFuture<SendResult<String, OrderEvent>>());

        producer.publishDraftCreated(draft(), "o1-1234");

        ArgumentCaptor<OrderEvent> captor = ArgumentCaptor.forClass(OrderEvent.class);
        verify(kafkaTemplate).send(eq("order-events"), eq("ref_1"), captor.capture());
        OrderEvent event = captor.getValue();
        assertThat(event.getEventType()).isEqualTo(OrderEvent.DRAFT_CREATED);
        assertThat(event.getLocalOrderId()).isEqualTo("o1-1234");
        assertThat(event.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(event.getProfitMinor()).isEqualTo(800L);
        assertThat(event.getTimestamp()).isEqualTo(CLOCK.instant());
    }

    @Test
    void transitionEventCarriesTerminalStatusAndChannel() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenReturn(new CompletableFuture<SendResult<String, OrderEvent>>());
        Instant processedAt = Instant.parse("2026-03-01T10:16:00Z");

        producer.publishTransition(Order.builder()
                .paymentReference("ref_1")
                .localOrderId("o1-1234")
                .status(OrderStatus.FAILED)
                .gateway(GatewayType.STRIPE)
                .processedAt(processedAt)
                .build(), "webhook");

        ArgumentCaptor<OrderEvent> captor = ArgumentCaptor.forClass(OrderEvent.class);
        verify(kafkaTemplate).send(eq("order-events"), eq("ref_1"), captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(OrderEvent.FAILED);
        assertThat(captor.getValue().getChannel()).isEqualTo("webhook");
        assertThat(captor.getValue().getTimestamp()).isEqualTo(processedAt);
    }

    @Test
    void transitionWithoutProcessedAtIsStampedFromClock() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenReturn(new CompletableFuture<SendResult<String, OrderEvent>>());

        producer.publishTransition(Order.builder()
                .paymentReference("ref_1")
                .status(OrderStatus.PAID)
                .gateway(GatewayType.PAYSTACK)
                .build(), "poll");

        ArgumentCaptor<OrderEvent> captor = ArgumentCaptor.forClass(OrderEvent.class);
        verify(kafkaTemplate).send(eq("order-events"), eq("ref_1"), captor.capture());
        assertThat(captor.getValue().getTimestamp()).isEqualTo(CLOCK.instant());
    }

    @Test
    void brokerFailureDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenThrow(new KafkaException("Send failed"));

        assertThatCode(() -> producer.publishDraftCreated(draft(), "o1-1234")).doesNotThrowAnyException();
    }

    @Test
    void failedFutureIsOnlyLogged() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> producer.publishDraftCreated(draft(), "o1-1234")).doesNotThrowAnyException();
    }

    @Test
    void disabledEventsAreNotSent() {
        properties.getEvents().setEnabled(false);

        producer.publishDraftCreated(draft(), "o1-1234");

        verifyNoInteractions(kafkaTemplate);
    }

    private static DraftOrder draft() {
        return DraftOrder.builder()
                .paymentReference("ref_1")
                .gateway(GatewayType.PAYSTACK)
                .customer(Customer.empty())
                .items(List.of())
                .totalMinorNgn(4500L)
                .supplierShareMinor(1200L)
                .profitMinor(800L)
                .build();
    }
}
