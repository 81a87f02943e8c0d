package com.dropship.checkout.persistence.service;

import com.dropship.checkout.api.LedgerPersistenceException;
import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.dropship.checkout.persistence.entity.OrderEntity;
import com.dropship.checkout.persistence.repository.OrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed ledger. Draft idempotency comes from {@code ON CONFLICT DO NOTHING} on the
 * payment reference primary key; transitions are a single conditional UPDATE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "checkout.ledger.type", havingValue = "jpa", matchIfMissing = true)
public class JpaOrderLedger implements OrderLedger {

    private final OrderRepository orderRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public String createDraft(DraftOrder draft) {
        OrderDrafts.requireValid(draft);
        Instant now = clock.instant();
        OrderEntity entity = toEntity(draft, OrderDrafts.newLocalOrderId(now.toEpochMilli()), now);
        try {
            if (orderRepository.insertIfAbsent(entity) == 1) {
                log.info("Draft order recorded: localOrderId={}, reference={}, gateway={}",
                        entity.getLocalOrderId(), entity.getPaymentReference(), entity.getGateway());
                return entity.getLocalOrderId();
            }
            String existing = orderRepository.findById(draft.getPaymentReference())
                    .map(OrderEntity::getLocalOrderId)
                    .orElseThrow(() -> new LedgerPersistenceException(
                            "Order for reference " + draft.getPaymentReference() + " vanished after conflict"));
            log.info("Draft for reference={} already recorded as localOrderId={}, keeping first write",
                    draft.getPaymentReference(), existing);
            return existing;
        } catch (DataAccessException e) {
            log.error("Failed to record draft order: reference={}", draft.getPaymentReference(), e);
            throw new LedgerPersistenceException("Failed to record order " + draft.getPaymentReference(), e);
        }
    }

    @Override
    @Transactional
    public boolean transition(String paymentReference, OrderStatus target) {
        if (target == null || !target.isTerminal()) {
            throw new IllegalArgumentException("Orders can only move to a terminal status, got " + target);
        }
        try {
            int updated = orderRepository.updateStatusIfCurrent(
                    paymentReference, OrderStatus.PENDING, target, clock.instant());
            if (updated == 0) {
                log.info("No pending order for reference={}, {} ignored", paymentReference, target);
                return false;
            }
            log.info("Order reference={} moved to {}", paymentReference, target);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to update order: reference={}, target={}", paymentReference, target, e);
            throw new LedgerPersistenceException("Failed to update order " + paymentReference, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByReference(String paymentReference) {
        try {
            return orderRepository.findById(paymentReference).map(JpaOrderLedger::toOrder);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to read order " + paymentReference, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> listOrders() {
        try {
            return orderRepository.findAllByOrderByCreatedAtDesc().stream()
                    .map(JpaOrderLedger::toOrder)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to list orders", e);
        }
    }

    private OrderEntity toEntity(DraftOrder draft, String localOrderId, Instant createdAt) {
        Customer customer = draft.getCustomer() != null ? draft.getCustomer() : Customer.empty();
        return OrderEntity.builder()
                .paymentReference(draft.getPaymentReference())
                .localOrderId(localOrderId)
                .status(OrderStatus.PENDING)
                .gateway(draft.getGateway())
                .customerName(customer.getName())
                .customerEmail(customer.getEmail())
                .customerPhone(customer.getPhone())
                .customerAddress(customer.getAddress())
                .customerState(customer.getState())
                .itemsJson(OrderDrafts.itemsJson(objectMapper, draft.getItems()))
                .totalMinorUsd(draft.getTotalMinorUsd())
                .totalMinorNgn(draft.getTotalMinorNgn())
                .supplierShareMinor(draft.getSupplierShareMinor())
                .profitMinor(draft.getProfitMinor())
                .gatewayResponse(draft.getGatewayResponse())
                .createdAt(createdAt)
                .build();
    }

    private static Order toOrder(OrderEntity entity) {
        return Order.builder()
                .localOrderId(entity.getLocalOrderId())
                .paymentReference(entity.getPaymentReference())
                .status(entity.getStatus())
                .gateway(entity.getGateway())
                .customer(Customer.of(entity.getCustomerName(), entity.getCustomerEmail(),
                        entity.getCustomerPhone(), entity.getCustomerAddress(), entity.getCustomerState()))
                .itemsJson(entity.getItemsJson())
                .totalMinorUsd(entity.getTotalMinorUsd())
                .totalMinorNgn(entity.getTotalMinorNgn())
                .supplierShareMinor(entity.getSupplierShareMinor())
                .profitMinor(entity.getProfitMinor())
                .supplierResponse(entity.getSupplierResponse())
                .gatewayResponse(entity.getGatewayResponse())
                .createdAt(entity.getCreatedAt())
                .processedAt(entity.getProcessedAt())
                .build();
    }
}
