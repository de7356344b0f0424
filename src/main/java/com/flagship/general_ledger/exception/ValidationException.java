package com.flagship.general_ledger.exception;

/**
 * Malformed input, detected before any side effect.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
