package com.flagship.general_ledger.exception;

/**
 * Backward or skipping accounting-period status change.
 */
public class PeriodTransitionException extends LedgerException {

    public PeriodTransitionException(String message) {
        super(ErrorCode.ILLEGAL_PERIOD_TRANSITION, message);
    }
}
