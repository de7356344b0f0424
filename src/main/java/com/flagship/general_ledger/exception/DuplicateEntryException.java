package com.flagship.general_ledger.exception;

/**
 * A journal entry id was reused within a tenant.
 */
public class DuplicateEntryException extends LedgerException {

    private final String journalEntryId;

    public DuplicateEntryException(String tenantId, String journalEntryId) {
        super(ErrorCode.DUPLICATE_ENTRY,
            String.format("Journal entry %s already exists for tenant %s", journalEntryId, tenantId));
        this.journalEntryId = journalEntryId;
    }

    public String getJournalEntryId() {
        return journalEntryId;
    }
}
