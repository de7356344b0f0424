package com.flagship.general_ledger.journal;

/**
 * Purpose of a journal entry. Decides which period states accept it.
 */
public enum EntryKind {
    /** Ordinary business transaction; OPEN periods only. */
    STANDARD,
    /** Post-close correction; also accepted by CLOSED periods that allow adjustments. */
    ADJUSTING,
    /** Year/period-end closing entry; also accepted by CLOSED periods that allow closing entries. */
    CLOSING,
    /** Mirror of a posted entry; treated like an adjustment. */
    REVERSAL
}
