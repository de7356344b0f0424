package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.SpecialAccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Request DTO for opening an account. Accounts always open at zero.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @Pattern(regexp = "^[A-Z0-9]{3,20}$", message = "Account code must be 3-20 uppercase alphanumeric characters")
    @JsonProperty("account_code")
    String accountCode;

    @NotBlank(message = "Account name is required")
    @JsonProperty("account_name")
    String accountName;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("special_account_type")
    SpecialAccountType specialAccountType;

    @JsonProperty("parent_account_code")
    String parentAccountCode;

    @JsonProperty("posting_allowed")
    Boolean postingAllowed;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("companion_links")
    CompanionLinksRequest companionLinks;
}
