package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Value;

/**
 * Debit and credit column totals of a trial balance in one currency.
 */
@Value
public class CurrencyTotals {
    CurrencyCode currency;
    Money totalDebits;
    Money totalCredits;
    /** totalDebits - totalCredits; zero when balanced. */
    Money difference;
    boolean balanced;

    public static CurrencyTotals of(CurrencyCode currency, Money totalDebits, Money totalCredits) {
        Money difference = totalDebits.subtract(totalCredits);
        boolean balanced = difference.abs().compareTo(Money.minorUnit(currency)) < 0;
        return new CurrencyTotals(currency, totalDebits, totalCredits, difference, balanced);
    }
}
