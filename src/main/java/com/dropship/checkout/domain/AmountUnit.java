package com.dropship.checkout.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Declares whether a cart amount is in major units (dollars, naira) or minor units
 * (cents, kobo). When a caller leaves it out, {@link com.dropship.checkout.core.MoneyUnits}
 * falls back to inferring the unit from the value.
 */
public enum AmountUnit {
    MAJOR,
    MINOR;

    @JsonCreator
    public static AmountUnit fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AmountUnit.valueOf(value.trim().toUpperCase());
    }
}
