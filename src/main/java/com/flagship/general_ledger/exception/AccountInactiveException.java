package com.flagship.general_ledger.exception;

/**
 * A journal line references a deactivated account.
 */
public class AccountInactiveException extends LedgerException {

    public AccountInactiveException(String message) {
        super(ErrorCode.ACCOUNT_INACTIVE, message);
    }
}
