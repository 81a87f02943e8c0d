package com.dropship.checkout.core;

import com.dropship.checkout.config.CheckoutProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Flat shipping fee per Nigerian state, in kobo. Unknown or missing regions get the default fee.
 */
@Component
@RequiredArgsConstructor
public class ShippingFeeResolver {

    private final CheckoutProperties properties;

    public long resolveFee(String region) {
        CheckoutProperties.Shipping shipping = properties.getShipping();
        if (region == null || region.isBlank()) {
            return shipping.getDefaultFee();
        }
        Long fee = shipping.getFees().get(region.trim());
        return fee != null ? fee : shipping.getDefaultFee();
    }
}
