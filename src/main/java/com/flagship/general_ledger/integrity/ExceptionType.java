package com.flagship.general_ledger.integrity;

public enum ExceptionType {
    UNBALANCED_ENTRY,
    ORPHANED_COMPANION_LINK,
    COMPANION_TYPE_MISMATCH,
    POSTING_TO_INACTIVE_ACCOUNT,
    POSTING_TO_NON_POSTING_ACCOUNT,
    POSTING_TO_UNKNOWN_ACCOUNT,
    CURRENCY_MISMATCH,
    BALANCE_DRIFT,
    POLARITY_VIOLATION,
    TRIAL_BALANCE_IMBALANCE,
    WARNING
}
