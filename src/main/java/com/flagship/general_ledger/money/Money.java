package com.flagship.general_ledger.money;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.Objects;

/**
 * Monetary amount held as a decimal scaled to the currency's minor units.
 *
 * Construction is exact: an amount with more decimals than the currency
 * allows is rejected rather than rounded. Rounding only happens in
 * {@link #convert(BigDecimal, CurrencyCode)}, HALF_EVEN at the target's minor
 * units. Arithmetic never mixes currencies.
 */
@Value
public class Money implements Comparable<Money> {

    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private static final Comparator<Money> ORDER = Comparator
        .comparing(Money::getCurrency)
        .thenComparing(Money::getAmount);

    BigDecimal amount;
    CurrencyCode currency;

    private Money(BigDecimal amount, CurrencyCode currency) {
        this.amount = amount;
        this.currency = currency;
    }

    public static Money of(BigDecimal amount, CurrencyCode currency) {
        if (amount == null) {
            throw new ValidationException("Amount is required");
        }
        if (currency == null) {
            throw new ValidationException("Currency is required");
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > currency.getMinorUnits()) {
            throw new ValidationException(String.format(
                "Amount %s has more than %d decimal places for %s",
                amount.toPlainString(), currency.getMinorUnits(), currency));
        }
        return new Money(amount.setScale(currency.getMinorUnits(), ROUNDING), currency);
    }

    public static Money of(double amount, CurrencyCode currency) {
        if (!Double.isFinite(amount)) {
            throw new ValidationException("Invalid amount (not finite): " + amount);
        }
        return of(BigDecimal.valueOf(amount), currency);
    }

    public static Money of(String amount, CurrencyCode currency) {
        try {
            return of(new BigDecimal(amount), currency);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid amount: " + amount);
        }
    }

    public static Money ofMinorUnits(long minorUnits, CurrencyCode currency) {
        Objects.requireNonNull(currency, "currency");
        return new Money(BigDecimal.valueOf(minorUnits, currency.getMinorUnits()), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return ofMinorUnits(0, currency);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(amount.add(other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(amount.subtract(other.amount), currency);
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public Money abs() {
        return amount.signum() < 0 ? negate() : this;
    }

    /**
     * Converts into another currency at the given rate (units of target per
     * unit of this currency), rounding HALF_EVEN.
     */
    public Money convert(BigDecimal rate, CurrencyCode target) {
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationException("Exchange rate must be positive: " + rate);
        }
        Objects.requireNonNull(target, "target");
        return new Money(amount.multiply(rate).setScale(target.getMinorUnits(), ROUNDING), target);
    }

    public int signum() {
        return amount.signum();
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public long toMinorUnits() {
        return amount.movePointRight(currency.getMinorUnits()).longValueExact();
    }

    /**
     * Smallest representable positive amount in this currency.
     */
    public static Money minorUnit(CurrencyCode currency) {
        return ofMinorUnits(1, currency);
    }

    @Override
    public int compareTo(Money other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other");
        if (other.currency != currency) {
            throw new ValidationException(
                String.format("Currency mismatch: %s vs %s", currency, other.currency));
        }
    }
}
