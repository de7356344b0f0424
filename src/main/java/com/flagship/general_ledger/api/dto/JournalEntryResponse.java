package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.EntryType;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.journal.JournalEntryStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("journal_entry_id")
    String journalEntryId;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    @JsonProperty("accounting_period")
    String accountingPeriod;

    @JsonProperty("entry_kind")
    EntryKind entryKind;

    @JsonProperty("status")
    JournalEntryStatus status;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("reversal_of")
    String reversalOf;

    @JsonProperty("reversed_by")
    String reversedBy;

    @JsonProperty("reversal_reason")
    String reversalReason;

    @JsonProperty("lines")
    List<Line> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .journalEntryId(entry.getJournalEntryId())
            .reference(entry.getReference())
            .description(entry.getDescription())
            .postingDate(entry.getPostingDate())
            .accountingPeriod(entry.getAccountingPeriod())
            .entryKind(entry.getEntryKind())
            .status(entry.getStatus())
            .postedBy(entry.getPostedBy())
            .postedAt(entry.getPostedAt())
            .reversalOf(entry.getReversalOf())
            .reversedBy(entry.getReversedBy())
            .reversalReason(entry.getReversalReason())
            .lines(entry.getLines().stream().map(Line::from).collect(Collectors.toList()))
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("side")
        EntryType side;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("currency")
        String currency;

        @JsonProperty("exchange_rate")
        BigDecimal exchangeRate;

        @JsonProperty("settlement_amount")
        BigDecimal settlementAmount;

        @JsonProperty("settlement_currency")
        String settlementCurrency;

        @JsonProperty("description")
        String description;

        static Line from(JournalEntryLine line) {
            return Line.builder()
                .accountCode(line.getAccountCode())
                .side(line.getSide())
                .amount(line.getAmount().getAmount())
                .currency(line.getAmount().getCurrency().name())
                .exchangeRate(line.getExchangeRate())
                .settlementAmount(line.isSettled() ? line.getSettlementAmount().getAmount() : null)
                .settlementCurrency(line.isSettled() ? line.getSettlementAmount().getCurrency().name() : null)
                .description(line.getDescription())
                .build();
        }
    }
}
