package com.dropship.checkout.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Sent by the client after it confirmed a Stripe payment intent.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class PlaceOrderRequestDto extends CheckoutRequestDto {

    @NotBlank(message = "paymentIntentId required")
    private String paymentIntentId;
}
