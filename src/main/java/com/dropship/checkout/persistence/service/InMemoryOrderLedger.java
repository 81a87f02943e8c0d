package com.dropship.checkout.persistence.service;

import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local ledger for development and tests ({@code checkout.ledger.type=memory}).
 * Orders are lost on restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "checkout.ledger.type", havingValue = "memory")
public class InMemoryOrderLedger implements OrderLedger {

    private final Map<String, Entry> orders = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryOrderLedger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String createDraft(DraftOrder draft) {
        OrderDrafts.requireValid(draft);
        Instant now = clock.instant();
        Customer customer = draft.getCustomer() != null ? draft.getCustomer() : Customer.empty();
        Order candidate = Order.builder()
                .localOrderId(OrderDrafts.newLocalOrderId(now.toEpochMilli()))
                .paymentReference(draft.getPaymentReference())
                .status(OrderStatus.PENDING)
                .gateway(draft.getGateway())
                .customer(customer)
                .itemsJson(OrderDrafts.itemsJson(objectMapper, draft.getItems()))
                .totalMinorUsd(draft.getTotalMinorUsd())
                .totalMinorNgn(draft.getTotalMinorNgn())
                .supplierShareMinor(draft.getSupplierShareMinor())
                .profitMinor(draft.getProfitMinor())
                .gatewayResponse(draft.getGatewayResponse())
                .createdAt(now)
                .build();
        Entry existing = orders.putIfAbsent(draft.getPaymentReference(),
                new Entry(candidate, sequence.incrementAndGet()));
        if (existing != null) {
            log.info("Draft for reference={} already recorded as localOrderId={}, keeping first write",
                    draft.getPaymentReference(), existing.order.getLocalOrderId());
            return existing.order.getLocalOrderId();
        }
        log.info("Draft order recorded: localOrderId={}, reference={}, gateway={}",
                candidate.getLocalOrderId(), candidate.getPaymentReference(), candidate.getGateway());
        return candidate.getLocalOrderId();
    }

    @Override
    public boolean transition(String paymentReference, OrderStatus target) {
        if (target == null || !target.isTerminal()) {
            throw new IllegalArgumentException("Orders can only move to a terminal status, got " + target);
        }
        if (paymentReference == null) {
            return false;
        }
        AtomicBoolean changed = new AtomicBoolean(false);
        orders.computeIfPresent(paymentReference, (ref, entry) -> {
            if (entry.order.getStatus() != OrderStatus.PENDING) {
                return entry;
            }
            changed.set(true);
            return new Entry(entry.order.toBuilder()
                    .status(target)
                    .processedAt(clock.instant())
                    .build(), entry.seq);
        });
        if (changed.get()) {
            log.info("Order reference={} moved to {}", paymentReference, target);
        } else {
            log.info("No pending order for reference={}, {} ignored", paymentReference, target);
        }
        return changed.get();
    }

    @Override
    public Optional<Order> findByReference(String paymentReference) {
        if (paymentReference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(orders.get(paymentReference)).map(e -> e.order);
    }

    @Override
    public List<Order> listOrders() {
        return orders.values().stream()
                .sorted(Comparator.comparing((Entry e) -> e.order.getCreatedAt())
                        .thenComparingLong(e -> e.seq)
                        .reversed())
                .map(e -> e.order)
                .collect(Collectors.toList());
    }

    private record Entry(Order order, long seq) {
    }
}
