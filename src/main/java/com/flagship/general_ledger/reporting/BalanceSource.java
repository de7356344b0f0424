package com.flagship.general_ledger.reporting;

/**
 * Where a report takes account balances from.
 */
public enum BalanceSource {
    /** Balances as stored on the accounts. */
    STORED,
    /** Balances rebuilt by replaying posted journal lines. */
    REPLAY
}
