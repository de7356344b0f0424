package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.PostJournalEntryCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class PostJournalEntryRequest {

    @NotBlank(message = "Journal entry ID is required")
    @JsonProperty("journal_entry_id")
    String journalEntryId;

    @NotNull(message = "Posting date is required")
    @JsonProperty("posting_date")
    LocalDate postingDate;

    @NotBlank(message = "Accounting period is required")
    @JsonProperty("accounting_period")
    String accountingPeriod;

    @JsonProperty("entry_kind")
    EntryKind entryKind;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @NotBlank(message = "Posted by is required")
    @JsonProperty("posted_by")
    String postedBy;

    @NotNull(message = "Lines are required")
    @Size(min = 2, message = "A journal entry needs at least two lines")
    @Valid
    @JsonProperty("lines")
    List<JournalLineRequest> lines;

    public PostJournalEntryCommand toCommand(String tenantId) {
        return PostJournalEntryCommand.builder()
            .tenantId(tenantId)
            .journalEntryId(journalEntryId)
            .postingDate(postingDate)
            .accountingPeriod(accountingPeriod)
            .entryKind(entryKind)
            .reference(reference)
            .description(description)
            .postedBy(postedBy)
            .lines(lines.stream().map(JournalLineRequest::toLine).collect(Collectors.toList()))
            .build();
    }
}
