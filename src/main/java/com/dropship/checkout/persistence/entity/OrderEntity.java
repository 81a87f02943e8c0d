package com.dropship.checkout.persistence.entity;

import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.OrderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent order row. The payment reference is the primary key, so the database itself
 * guarantees one row per payment attempt. Schema lives in schema.sql.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_local_order_id", columnList = "local_order_id"),
    @Index(name = "idx_orders_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "local_order_id", nullable = false)
    private String localOrderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway")
    private GatewayType gateway;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @Column(name = "customer_phone", nullable = false)
    private String customerPhone;

    @Column(name = "customer_address", nullable = false)
    private String customerAddress;

    @Column(name = "customer_state", nullable = false)
    private String customerState;

    @Column(name = "items_json", nullable = false, columnDefinition = "text")
    private String itemsJson;

    @Column(name = "total_minor_usd", nullable = false)
    private long totalMinorUsd;

    @Column(name = "total_minor_ngn", nullable = false)
    private long totalMinorNgn;

    @Column(name = "supplier_share_minor", nullable = false)
    private long supplierShareMinor;

    @Column(name = "profit_minor", nullable = false)
    private long profitMinor;

    @Column(name = "supplier_response", columnDefinition = "text")
    private String supplierResponse;

    @Column(name = "gateway_response", columnDefinition = "text")
    private String gatewayResponse;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
