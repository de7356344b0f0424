package com.flagship.general_ledger.exception;

/**
 * An account with the same code already exists for the tenant.
 */
public class DuplicateAccountException extends LedgerException {

    public DuplicateAccountException(String message) {
        super(ErrorCode.DUPLICATE_ACCOUNT, message);
    }
}
