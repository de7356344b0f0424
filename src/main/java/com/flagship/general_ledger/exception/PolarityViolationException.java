package com.flagship.general_ledger.exception;

/**
 * A balance change would leave an account with a balance of the wrong sign.
 */
public class PolarityViolationException extends LedgerException {

    public PolarityViolationException(String message) {
        super(ErrorCode.POLARITY_VIOLATION, message);
    }
}
