package com.flagship.general_ledger.journal;

/**
 * Side of a journal line in double-entry accounting.
 * Every entry must have balanced debits and credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public EntryType opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
