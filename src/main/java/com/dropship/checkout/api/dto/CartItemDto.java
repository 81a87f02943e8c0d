package com.dropship.checkout.api.dto;

import com.dropship.checkout.domain.AmountUnit;
import com.dropship.checkout.domain.CartItem;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * One cart line in a checkout request.
 */
@Data
public class CartItemDto {

    private String id;
    private String title;

    @NotNull(message = "price is required")
    @DecimalMin(value = "0", message = "price must not be negative")
    private BigDecimal price;

    @DecimalMin(value = "0", message = "supplierCost must not be negative")
    private BigDecimal supplierCost;

    /** Defaults to 1 when omitted. */
    @Min(value = 1, message = "quantity must be at least 1")
    private Integer quantity;

    private String sku;

    /** {@code major} or {@code minor}; omitted means the unit is inferred from the value. */
    private AmountUnit unit;

    public CartItem toCartItem() {
        return CartItem.builder()
                .id(id)
                .title(title)
                .price(price)
                .supplierCost(supplierCost != null ? supplierCost : BigDecimal.ZERO)
                .quantity(quantity != null ? quantity : 1)
                .sku(sku != null ? sku : "")
                .unit(unit)
                .build();
    }
}
