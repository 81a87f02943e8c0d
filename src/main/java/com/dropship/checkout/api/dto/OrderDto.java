package com.dropship.checkout.api.dto;

import com.dropship.checkout.core.MoneyUnits;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order as shown to the storefront and the admin order list.
 */
@Value
@Builder
public class OrderDto {

    String localOrderId;
    String paymentReference;
    OrderStatus status;
    GatewayType gateway;
    String customerName;
    String customerEmail;
    String customerPhone;
    String customerAddress;
    String customerState;
    /** Cart snapshot, emitted as a JSON array. */
    @JsonRawValue
    String items;
    long totalMinorUsd;
    long totalMinorNgn;
    BigDecimal totalUsd;
    BigDecimal totalNgn;
    long supplierShareMinor;
    long profitMinor;
    String supplierResponse;
    Instant createdAt;
    Instant processedAt;

    public static OrderDto from(Order order) {
        return OrderDto.builder()
                .localOrderId(order.getLocalOrderId())
                .paymentReference(order.getPaymentReference())
                .status(order.getStatus())
                .gateway(order.getGateway())
                .customerName(order.getCustomer().getName())
                .customerEmail(order.getCustomer().getEmail())
                .customerPhone(order.getCustomer().getPhone())
                .customerAddress(order.getCustomer().getAddress())
                .customerState(order.getCustomer().getState())
                .items(order.getItemsJson() != null ? order.getItemsJson() : "[]")
                .totalMinorUsd(order.getTotalMinorUsd())
                .totalMinorNgn(order.getTotalMinorNgn())
                .totalUsd(MoneyUnits.toMajorUnits(order.getTotalMinorUsd()))
                .totalNgn(MoneyUnits.toMajorUnits(order.getTotalMinorNgn()))
                .supplierShareMinor(order.getSupplierShareMinor())
                .profitMinor(order.getProfitMinor())
                .supplierResponse(order.getSupplierResponse())
                .createdAt(order.getCreatedAt())
                .processedAt(order.getProcessedAt())
                .build();
    }
}
