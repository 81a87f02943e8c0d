package com.dropship.checkout.persistence.repository;

import com.dropship.checkout.domain.OrderStatus;
import com.dropship.checkout.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for orders.
 */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    /**
     * Inserts the draft unless a row with the same payment reference exists. The conflict is
     * resolved by the primary key inside PostgreSQL, so concurrent writers cannot both insert.
     *
     * @return 1 if inserted, 0 if the reference was already taken
     */
    @Modifying
    @Query(value = """
            INSERT INTO orders (payment_reference, local_order_id, status, gateway,
                                customer_name, customer_email, customer_phone, customer_address, customer_state,
                                items_json, total_minor_usd, total_minor_ngn, supplier_share_minor, profit_minor,
                                gateway_response, created_at)
            VALUES (:#{#o.paymentReference}, :#{#o.localOrderId}, :#{#o.status.name()}, CAST(:#{#o.gateway?.name()} AS text),
                    :#{#o.customerName}, :#{#o.customerEmail}, :#{#o.customerPhone}, :#{#o.customerAddress},
                    :#{#o.customerState}, :#{#o.itemsJson}, :#{#o.totalMinorUsd}, :#{#o.totalMinorNgn},
                    :#{#o.supplierShareMinor}, :#{#o.profitMinor}, CAST(:#{#o.gatewayResponse} AS text), :#{#o.createdAt})
            ON CONFLICT (payment_reference) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("o") OrderEntity order);

    /**
     * Moves an order from {@code expected} to {@code target} and stamps processed_at, only if it
     * is still in {@code expected}. Two racing confirmations cannot both win.
     *
     * @return number of rows changed (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :target, o.processedAt = :processedAt "
            + "WHERE o.paymentReference = :reference AND o.status = :expected")
    int updateStatusIfCurrent(@Param("reference") String paymentReference,
                              @Param("expected") OrderStatus expected,
                              @Param("target") OrderStatus target,
                              @Param("processedAt") Instant processedAt);

    List<OrderEntity> findAllByOrderByCreatedAtDesc();
}
