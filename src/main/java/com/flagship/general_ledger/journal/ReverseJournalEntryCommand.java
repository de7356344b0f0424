package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ReversalException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Request to reverse a posted entry.
 *
 * Optional fields default from the original: the reversal id to
 * {@code REV-<original id>}, the date to the original posting date and the
 * period to the period containing that date.
 */
@Value
public class ReverseJournalEntryCommand {

    String tenantId;
    String journalEntryId;
    String reason;
    String reversedBy;
    String reversalEntryId;
    LocalDate reversalDate;
    String accountingPeriod;

    @Builder
    private ReverseJournalEntryCommand(String tenantId, String journalEntryId, String reason, String reversedBy,
                                       String reversalEntryId, LocalDate reversalDate, String accountingPeriod) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (journalEntryId == null || journalEntryId.isBlank()) {
            throw new ValidationException("Journal entry id is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ReversalException("Reversal reason is required for " + journalEntryId);
        }
        if (reversedBy == null || reversedBy.isBlank()) {
            throw new ValidationException("Reversed by is required");
        }
        this.tenantId = tenantId.trim();
        this.journalEntryId = journalEntryId.trim();
        this.reason = reason.trim();
        this.reversedBy = reversedBy.trim();
        this.reversalEntryId = reversalEntryId == null || reversalEntryId.isBlank()
            ? "REV-" + this.journalEntryId
            : reversalEntryId.trim();
        this.reversalDate = reversalDate;
        this.accountingPeriod = accountingPeriod == null || accountingPeriod.isBlank() ? null : accountingPeriod.trim();
    }
}
