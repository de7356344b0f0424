package com.flagship.general_ledger.account;

import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Value;

/**
 * Request to open an account. New accounts always start at a zero balance;
 * opening balances are posted as journal entries.
 */
@Value
public class CreateAccountCommand {

    String tenantId;
    String accountCode;
    String accountName;
    AccountType accountType;
    SpecialAccountType specialAccountType;
    String parentAccountCode;
    boolean postingAllowed;
    CurrencyCode currency;
    CompanionLinks companionLinks;

    @Builder
    private CreateAccountCommand(String tenantId, String accountCode, String accountName, AccountType accountType,
                                 SpecialAccountType specialAccountType, String parentAccountCode,
                                 Boolean postingAllowed, CurrencyCode currency, CompanionLinks companionLinks) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Tenant ID is required");
        }
        if (accountType == null) {
            throw new ValidationException("Account type is required");
        }
        this.tenantId = tenantId.trim();
        this.accountCode = accountCode;
        this.accountName = accountName;
        this.accountType = accountType;
        this.specialAccountType = specialAccountType != null ? specialAccountType : SpecialAccountType.NONE;
        this.parentAccountCode = parentAccountCode;
        this.postingAllowed = postingAllowed == null || postingAllowed;
        this.currency = currency;
        this.companionLinks = companionLinks != null ? companionLinks : CompanionLinks.NONE;
    }
}
