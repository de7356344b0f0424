package com.flagship.general_ledger.integrity;

import com.flagship.general_ledger.journal.EntryType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Difference between an expected and an actual account balance.
 */
@Value
public class Variance {
    String accountCode;
    String accountName;
    BigDecimal expectedBalance;
    BigDecimal actualBalance;
    /** actual - expected */
    BigDecimal variance;
    BigDecimal variancePercentage;
    /** Side of the actual balance. */
    EntryType varianceType;
    Severity severity;

    public static Variance of(String accountCode, String accountName, BigDecimal expected, BigDecimal actual) {
        BigDecimal variance = actual.subtract(expected);
        return new Variance(
            accountCode,
            accountName,
            expected,
            actual,
            variance,
            Severity.percentage(variance.abs(), actual),
            actual.signum() >= 0 ? EntryType.DEBIT : EntryType.CREDIT,
            Severity.ofVariance(variance, actual)
        );
    }
}
