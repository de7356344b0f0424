package com.flagship.general_ledger.exception;

import java.math.BigDecimal;

/**
 * Debits and credits of a journal entry differ in one settlement currency.
 */
public class ImbalanceException extends LedgerException {

    private final String currency;
    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public ImbalanceException(String currency, BigDecimal debitTotal, BigDecimal creditTotal) {
        super(ErrorCode.IMBALANCED_ENTRY, String.format(
            "Journal entry is not balanced in %s: debits=%s, credits=%s",
            currency, debitTotal.toPlainString(), creditTotal.toPlainString()));
        this.currency = currency;
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getDebitTotal() {
        return debitTotal;
    }

    public BigDecimal getCreditTotal() {
        return creditTotal;
    }
}
