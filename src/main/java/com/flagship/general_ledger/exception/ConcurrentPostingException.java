package com.flagship.general_ledger.exception;

/**
 * Stored balances changed underneath a posting that was already validated. The posting is rolled back.
 */
public class ConcurrentPostingException extends LedgerException {

    public ConcurrentPostingException(String message) {
        super(ErrorCode.CONCURRENT_POSTING, message);
    }
}
