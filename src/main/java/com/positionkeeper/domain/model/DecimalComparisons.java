package com.positionkeeper.domain.model;

import java.math.BigDecimal;

/**
 * Scale-insensitive BigDecimal comparisons. {@code new BigDecimal("1.0")} and
 * {@code BigDecimal.ONE} are equal here, which {@link BigDecimal#equals} does not give.
 */
public final class DecimalComparisons {

    private DecimalComparisons() {}

    public static boolean equalsNullable(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return a.compareTo(b) == 0;
    }

    /** Equal within an absolute tolerance; two nulls are equal, one null is not. */
    public static boolean withinTolerance(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return a.subtract(b).abs().compareTo(tolerance) <= 0;
    }
}
