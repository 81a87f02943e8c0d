package com.dropship.checkout.core;

import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.ProfitSplit;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sums cart lines into a total and a supplier share. Only computes; rejecting an empty
 * cart or a negative profit is up to the caller.
 */
@Component
public class ProfitSplitCalculator {

    public ProfitSplit computeSplit(List<CartItem> items) {
        long total = 0L;
        long supplierShare = 0L;
        if (items != null) {
            for (CartItem item : items) {
                int quantity = item.getQuantity();
                total = Math.addExact(total,
                        Math.multiplyExact(MoneyUnits.toMinorUnits(item.getPrice(), item.getUnit()), quantity));
                supplierShare = Math.addExact(supplierShare,
                        Math.multiplyExact(MoneyUnits.toMinorUnits(item.getSupplierCost(), item.getUnit()), quantity));
            }
        }
        return new ProfitSplit(total, supplierShare);
    }
}
