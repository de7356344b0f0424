package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import com.flagship.general_ledger.account.SpecialAccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("special_account_type")
    SpecialAccountType specialAccountType;

    @JsonProperty("normal_balance")
    NormalBalance normalBalance;

    @JsonProperty("parent_account_code")
    String parentAccountCode;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("posting_allowed")
    boolean postingAllowed;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("companion_links")
    Map<SpecialAccountType, String> companionLinks;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountCode(account.getAccountCode())
            .accountName(account.getAccountName())
            .accountType(account.getAccountType())
            .specialAccountType(account.getSpecialAccountType())
            .normalBalance(account.getNormalBalance())
            .parentAccountCode(account.getParentAccountCode())
            .active(account.isActive())
            .postingAllowed(account.isPostingAllowed())
            .currency(account.getCurrency().name())
            .balance(account.getBalance().getAmount())
            .companionLinks(account.getCompanionLinks().targets())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
