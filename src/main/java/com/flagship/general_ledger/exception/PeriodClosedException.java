package com.flagship.general_ledger.exception;

/**
 * The target accounting period does not accept this kind of entry.
 */
public class PeriodClosedException extends LedgerException {

    private final String periodId;

    public PeriodClosedException(String periodId, String message) {
        super(ErrorCode.PERIOD_CLOSED, message);
        this.periodId = periodId;
    }

    public String getPeriodId() {
        return periodId;
    }
}
