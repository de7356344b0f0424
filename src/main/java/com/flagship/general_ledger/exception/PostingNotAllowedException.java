package com.flagship.general_ledger.exception;

/**
 * A journal line references a header or control account that does not accept postings.
 */
public class PostingNotAllowedException extends LedgerException {

    public PostingNotAllowedException(String message) {
        super(ErrorCode.POSTING_NOT_ALLOWED, message);
    }
}
