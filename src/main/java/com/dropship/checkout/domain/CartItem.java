package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One cart line as supplied by the caller. Prices are taken at face value; they are not
 * re-checked against the catalog.
 */
@Value
@Builder
public class CartItem {

    String id;
    String title;
    BigDecimal price;
    /** Supplier's unit cost; zero when the caller does not send one. */
    @Builder.Default
    BigDecimal supplierCost = BigDecimal.ZERO;
    @Builder.Default
    int quantity = 1;
    @Builder.Default
    String sku = "";
    /** Unit of {@link #price} and {@link #supplierCost}; null means infer. */
    AmountUnit unit;
}
