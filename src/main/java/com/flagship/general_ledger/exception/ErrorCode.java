package com.flagship.general_ledger.exception;

/**
 * Stable, machine-readable codes for every ledger rejection.
 * Used in API error bodies and as a metrics tag.
 */
public enum ErrorCode {
    VALIDATION_FAILED,
    IMBALANCED_ENTRY,
    PERIOD_CLOSED,
    ILLEGAL_PERIOD_TRANSITION,
    ACCOUNT_NOT_FOUND,
    ACCOUNT_INACTIVE,
    POSTING_NOT_ALLOWED,
    DUPLICATE_ENTRY,
    DUPLICATE_ACCOUNT,
    POLARITY_VIOLATION,
    REVERSAL_REJECTED,
    INTEGRITY_VIOLATION,
    POSTING_LOCK_TIMEOUT,
    CONCURRENT_POSTING
}
