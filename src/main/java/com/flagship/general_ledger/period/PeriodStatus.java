package com.flagship.general_ledger.period;

/**
 * Lifecycle of an accounting period. Moves forward one step at a time:
 * OPEN -> CLOSED -> LOCKED -> FINALIZED.
 */
public enum PeriodStatus {
    OPEN,
    CLOSED,
    LOCKED,
    FINALIZED;

    /**
     * The only status this one may move to, or {@code null} for FINALIZED.
     */
    public PeriodStatus next() {
        PeriodStatus[] values = values();
        return ordinal() + 1 < values.length ? values[ordinal() + 1] : null;
    }
}
