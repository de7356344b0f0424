package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.money.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a posting request. Exactly one of debit_amount and
 * credit_amount must be positive.
 */
@Value
public class JournalLineRequest {

    @NotBlank(message = "Account code is required")
    @JsonProperty("account_code")
    String accountCode;

    @DecimalMin(value = "0", message = "Debit amount cannot be negative")
    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @DecimalMin(value = "0", message = "Credit amount cannot be negative")
    @JsonProperty("credit_amount")
    BigDecimal creditAmount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("description")
    String description;

    public JournalEntryLine toLine() {
        return JournalEntryLine.of(accountCode, debitAmount, creditAmount,
            CurrencyCode.valueOf(currency), exchangeRate, description);
    }
}
