package com.dropship.checkout.core;

import com.dropship.checkout.domain.AmountUnit;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between major units (dollars, naira) and integer minor units (cents, kobo).
 * <p>
 * Without an explicit {@link AmountUnit} the unit is inferred: a whole number above 1000 is
 * taken to be minor units already, anything else is major units and is multiplied by 100
 * with half-up rounding. The rule misreads large major-unit prices (1500.00 naira is read as
 * 1500 kobo), so {@link #toMinorUnits(BigDecimal)} and {@link #toMajorUnits(Long)} are not
 * inverses: the round trip holds only for multiples of 100 in (1000, 100000]. Callers that
 * know their unit should pass it.
 */
public final class MoneyUnits {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MINOR_UNIT_THRESHOLD = BigDecimal.valueOf(1000);

    private MoneyUnits() {
    }

    /**
     * Non-finite input yields 0. This is a clamp, not validation.
     */
    public static long toMinorUnits(double value) {
        if (!Double.isFinite(value)) {
            return 0L;
        }
        return toMinorUnits(BigDecimal.valueOf(value));
    }

    public static long toMinorUnits(BigDecimal value) {
        return toMinorUnits(value, null);
    }

    public static long toMinorUnits(BigDecimal value, AmountUnit unit) {
        if (value == null) {
            return 0L;
        }
        if (unit == AmountUnit.MINOR) {
            return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        if (unit == null && isWholeNumber(value) && value.compareTo(MINOR_UNIT_THRESHOLD) > 0) {
            return value.longValueExact();
        }
        return value.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Null is treated as zero.
     */
    public static BigDecimal toMajorUnits(Long minor) {
        long amount = minor != null ? minor : 0L;
        return BigDecimal.valueOf(amount).divide(HUNDRED, 2, RoundingMode.UNNECESSARY);
    }

    private static boolean isWholeNumber(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
