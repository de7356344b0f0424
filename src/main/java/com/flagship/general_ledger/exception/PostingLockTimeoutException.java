package com.flagship.general_ledger.exception;

/**
 * The per-tenant posting section could not be acquired within the configured wait.
 */
public class PostingLockTimeoutException extends LedgerException {

    public PostingLockTimeoutException(String message) {
        super(ErrorCode.POSTING_LOCK_TIMEOUT, message);
    }
}
