package com.dropship.checkout.domain;

/**
 * Currency the caller priced the cart in.
 */
public enum PricingCurrency {
    USD,
    NGN
}
