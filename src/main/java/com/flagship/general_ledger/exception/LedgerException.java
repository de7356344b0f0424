package com.flagship.general_ledger.exception;

/**
 * Base type for every rejection raised by the ledger core.
 *
 * All subclasses are raised before any state is mutated; once a posting
 * reaches the store it either commits entirely or rolls back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
