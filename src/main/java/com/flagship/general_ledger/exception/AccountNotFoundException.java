package com.flagship.general_ledger.exception;

public class AccountNotFoundException extends LedgerException {

    private final String tenantId;
    private final String accountCode;

    public AccountNotFoundException(String tenantId, String accountCode) {
        super(ErrorCode.ACCOUNT_NOT_FOUND,
            String.format("Account not found: tenant=%s, code=%s", tenantId, accountCode));
        this.tenantId = tenantId;
        this.accountCode = accountCode;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getAccountCode() {
        return accountCode;
    }
}
