package com.flagship.general_ledger.account;

import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Raw attributes an {@link Account} is built from. Nothing here is validated;
 * {@link Account#create(AccountProperties)} is the only way in.
 */
@Value
@Builder(toBuilder = true)
public class AccountProperties {
    String tenantId;
    String accountCode;
    String accountName;
    AccountType accountType;
    SpecialAccountType specialAccountType;
    String parentAccountCode;
    @Builder.Default
    boolean active = true;
    @Builder.Default
    boolean postingAllowed = true;
    CurrencyCode currency;
    Money balance;
    CompanionLinks companionLinks;
    Instant createdAt;
    Instant updatedAt;
    /** When the account was last deactivated; null while active. */
    Instant deactivatedAt;
}
