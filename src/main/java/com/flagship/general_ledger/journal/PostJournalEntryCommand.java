package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Request to post a journal entry. Structural rules are checked when the
 * command is built, so an instance always has ids, a date, a period and at
 * least two lines.
 */
@Value
public class PostJournalEntryCommand {

    String tenantId;
    String journalEntryId;
    LocalDate postingDate;
    String accountingPeriod;
    EntryKind entryKind;
    String reference;
    String description;
    String postedBy;
    List<JournalEntryLine> lines;

    @Builder
    private PostJournalEntryCommand(String tenantId, String journalEntryId, LocalDate postingDate,
                                    String accountingPeriod, EntryKind entryKind, String reference,
                                    String description, String postedBy, List<JournalEntryLine> lines) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (journalEntryId == null || journalEntryId.isBlank()) {
            throw new ValidationException("Journal entry id is required");
        }
        if (postingDate == null) {
            throw new ValidationException("Posting date is required");
        }
        if (accountingPeriod == null || accountingPeriod.isBlank()) {
            throw new ValidationException("Accounting period is required");
        }
        if (postedBy == null || postedBy.isBlank()) {
            throw new ValidationException("Posted by is required");
        }
        if (lines == null || lines.size() < 2) {
            throw new ValidationException(String.format(
                "Journal entry %s must have at least two lines, got %d",
                journalEntryId, lines == null ? 0 : lines.size()));
        }
        if (lines.stream().anyMatch(line -> line == null)) {
            throw new ValidationException("Journal entry " + journalEntryId + " contains a null line");
        }
        this.tenantId = tenantId.trim();
        this.journalEntryId = journalEntryId.trim();
        this.postingDate = postingDate;
        this.accountingPeriod = accountingPeriod.trim();
        this.entryKind = entryKind != null ? entryKind : EntryKind.STANDARD;
        this.reference = reference;
        this.description = description;
        this.postedBy = postedBy.trim();
        this.lines = List.copyOf(lines);
    }
}
