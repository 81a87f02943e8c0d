package com.dropship.checkout.persistence.service;

import com.dropship.checkout.api.LedgerPersistenceException;
import com.dropship.checkout.api.ValidationException;
import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.DraftOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Helpers shared by the ledger implementations.
 */
final class OrderDrafts {

    private OrderDrafts() {
    }

    static String newLocalOrderId(long epochMillis) {
        return "o" + epochMillis + "-" + ThreadLocalRandom.current().nextInt(1000, 10000);
    }

    static void requireValid(DraftOrder draft) {
        if (draft == null || draft.getPaymentReference() == null || draft.getPaymentReference().isBlank()) {
            throw new ValidationException("Draft order needs a payment reference");
        }
        if (draft.getProfitMinor() < 0) {
            throw new ValidationException("Refusing to record an order with negative profit: " + draft.getProfitMinor());
        }
    }

    static String itemsJson(ObjectMapper objectMapper, List<CartItem> items) {
        try {
            return objectMapper.writeValueAsString(items != null ? items : List.of());
        } catch (JsonProcessingException e) {
            throw new LedgerPersistenceException("Could not serialize cart items", e);
        }
    }
}
