package com.dropship.checkout.domain;

import lombok.Value;

/**
 * Division of a cart total between the supplier and the merchant, in minor units of the
 * cart's pricing currency.
 */
@Value
public class ProfitSplit {

    long totalMinor;
    long supplierShareMinor;

    public long getProfitMinor() {
        return totalMinor - supplierShareMinor;
    }

    public boolean isLoss() {
        return getProfitMinor() < 0;
    }
}
