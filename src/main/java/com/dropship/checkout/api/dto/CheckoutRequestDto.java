package com.dropship.checkout.api.dto;

import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.Customer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Request body shared by the create-order endpoints.
 */
@Data
public class CheckoutRequestDto {

    @NotEmpty(message = "cartItems required")
    @Valid
    private List<CartItemDto> cartItems;

    @Valid
    private CustomerDto customer;

    public List<CartItem> toCartItems() {
        return cartItems.stream().map(CartItemDto::toCartItem).collect(Collectors.toList());
    }

    public Customer toCustomer() {
        return customer != null ? customer.toCustomer() : Customer.empty();
    }
}
