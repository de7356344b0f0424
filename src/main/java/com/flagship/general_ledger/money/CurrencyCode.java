package com.flagship.general_ledger.money;

/**
 * Currency code enum following ISO-4217.
 *
 * Each currency carries its minor-unit count, which fixes the scale every
 * {@link Money} amount in that currency is held at.
 */
public enum CurrencyCode {
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    MYR(2), // Malaysian Ringgit
    SGD(2), // Singapore Dollar
    JPY(0); // Japanese Yen

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    public int getMinorUnits() {
        return minorUnits;
    }
}
