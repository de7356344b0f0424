package com.flagship.general_ledger.journal;

public enum JournalEntryStatus {
    POSTED,
    REVERSED
}
