package com.flagship.general_ledger.integrity;

import java.math.BigDecimal;
import java.math.RoundingMode;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * Grades a variance by its absolute size and by its size relative to the
     * actual balance. A zero actual balance counts as a 100 % variance.
     */
    public static Severity ofVariance(BigDecimal variance, BigDecimal actual) {
        BigDecimal absolute = variance.abs();
        BigDecimal percentage = percentage(absolute, actual);
        if (percentage.compareTo(new BigDecimal("50")) > 0 || absolute.compareTo(new BigDecimal("100000")) > 0) {
            return CRITICAL;
        }
        if (percentage.compareTo(new BigDecimal("25")) > 0 || absolute.compareTo(new BigDecimal("10000")) > 0) {
            return HIGH;
        }
        if (percentage.compareTo(new BigDecimal("10")) > 0 || absolute.compareTo(new BigDecimal("1000")) > 0) {
            return MEDIUM;
        }
        return LOW;
    }

    static BigDecimal percentage(BigDecimal absoluteVariance, BigDecimal actual) {
        if (actual.signum() == 0) {
            return HUNDRED;
        }
        return absoluteVariance.multiply(HUNDRED).divide(actual.abs(), 2, RoundingMode.HALF_EVEN);
    }

    public boolean requiresAttention() {
        return this == HIGH || this == CRITICAL;
    }
}
