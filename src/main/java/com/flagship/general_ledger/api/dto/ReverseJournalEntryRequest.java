package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.ReverseJournalEntryCommand;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.time.LocalDate;

/**
 * Request DTO for reversing a posted entry. Date and period default to the
 * original's when omitted.
 */
@Value
public class ReverseJournalEntryRequest {

    @NotBlank(message = "Reversal reason is required")
    @JsonProperty("reason")
    String reason;

    @NotBlank(message = "Reversed by is required")
    @JsonProperty("reversed_by")
    String reversedBy;

    @JsonProperty("reversal_entry_id")
    String reversalEntryId;

    @JsonProperty("reversal_date")
    LocalDate reversalDate;

    @JsonProperty("accounting_period")
    String accountingPeriod;

    public ReverseJournalEntryCommand toCommand(String tenantId, String journalEntryId) {
        return ReverseJournalEntryCommand.builder()
            .tenantId(tenantId)
            .journalEntryId(journalEntryId)
            .reason(reason)
            .reversedBy(reversedBy)
            .reversalEntryId(reversalEntryId)
            .reversalDate(reversalDate)
            .accountingPeriod(accountingPeriod)
            .build();
    }
}
