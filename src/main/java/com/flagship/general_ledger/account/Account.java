package com.flagship.general_ledger.account;

import com.flagship.general_ledger.exception.PolarityViolationException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Chart-of-accounts node.
 *
 * Key principles:
 * - Immutable: every change produces a new, fully validated instance
 * - {@link #applyDelta(Money, Instant)} is the only way a balance moves
 * - Balances are signed debit-positive; polarity is checked on every transition
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Account {

    private static final Pattern ACCOUNT_CODE = Pattern.compile("^[A-Z0-9]{3,20}$");

    private final String tenantId;
    private final String accountCode;
    private final String accountName;
    private final AccountType accountType;
    private final SpecialAccountType specialAccountType;
    private final String parentAccountCode;
    private final boolean active;
    private final boolean postingAllowed;
    private final CurrencyCode currency;
    private final Money balance;
    private final CompanionLinks companionLinks;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deactivatedAt;

    private Account(AccountProperties properties) {
        this.tenantId = trim(properties.getTenantId());
        this.accountCode = trim(properties.getAccountCode());
        this.accountName = trim(properties.getAccountName());
        this.accountType = properties.getAccountType();
        this.specialAccountType = properties.getSpecialAccountType() != null
            ? properties.getSpecialAccountType()
            : SpecialAccountType.NONE;
        this.parentAccountCode = emptyToNull(trim(properties.getParentAccountCode()));
        this.active = properties.isActive();
        this.postingAllowed = properties.isPostingAllowed();
        this.currency = properties.getCurrency() != null
            ? properties.getCurrency()
            : properties.getBalance() != null ? properties.getBalance().getCurrency() : null;
        this.balance = properties.getBalance() != null
            ? properties.getBalance()
            : this.currency != null ? Money.zero(this.currency) : null;
        this.companionLinks = properties.getCompanionLinks() != null
            ? properties.getCompanionLinks().trimmed()
            : CompanionLinks.NONE;
        this.createdAt = properties.getCreatedAt();
        this.updatedAt = properties.getUpdatedAt() != null ? properties.getUpdatedAt() : properties.getCreatedAt();
        this.deactivatedAt = this.active ? null : properties.getDeactivatedAt();
    }

    /**
     * Builds and validates an account.
     *
     * @throws ValidationException if any structural rule is violated
     * @throws PolarityViolationException if the balance has the wrong sign for the account
     */
    public static Account create(AccountProperties properties) {
        if (properties == null) {
            throw new ValidationException("Account properties are required");
        }
        Account account = new Account(properties);
        account.validate();
        return account;
    }

    /**
     * Rehydrates a stored account. Structural rules are enforced but polarity
     * is not, so a drifted balance can be loaded and reported instead of
     * making the whole tenant unreadable.
     */
    public static Account restore(AccountProperties properties) {
        if (properties == null) {
            throw new ValidationException("Account properties are required");
        }
        Account account = new Account(properties);
        account.validateStructure();
        return account;
    }

    /**
     * Returns a new account with {@code delta} added to the balance.
     * Positive deltas are debits, negative deltas are credits.
     *
     * @throws PolarityViolationException if the new balance breaks polarity
     */
    public Account applyDelta(Money delta, Instant at) {
        if (delta == null) {
            throw new ValidationException("Delta is required");
        }
        if (delta.getCurrency() != currency) {
            throw new ValidationException(String.format(
                "Account %s is held in %s, cannot apply %s", accountCode, currency, delta));
        }
        return Account.create(toProperties()
            .balance(balance.add(delta))
            .updatedAt(at)
            .build());
    }

    /**
     * Deactivating an inactive account keeps its original deactivation time.
     */
    public Account deactivate(Instant at) {
        return Account.create(toProperties()
            .active(false)
            .deactivatedAt(active ? at : deactivatedAt)
            .updatedAt(at)
            .build());
    }

    public Account activate(Instant at) {
        return Account.create(toProperties().active(true).deactivatedAt(null).updatedAt(at).build());
    }

    public Account withCompanionLinks(CompanionLinks links, Instant at) {
        return Account.create(toProperties().companionLinks(links).updatedAt(at).build());
    }

    public boolean isDebitNormal() {
        return accountType.getNormalBalance() == NormalBalance.DEBIT;
    }

    public boolean isCreditNormal() {
        return accountType.getNormalBalance() == NormalBalance.CREDIT;
    }

    /**
     * Effective polarity: the special type's override when it has one,
     * otherwise the base type's.
     */
    public NormalBalance getNormalBalance() {
        NormalBalance override = specialAccountType.getPolarityOverride();
        return override != null ? override : accountType.getNormalBalance();
    }

    public boolean hasValidPolarity() {
        return getNormalBalance().permits(balance);
    }

    public boolean isContra() {
        return specialAccountType.isContra();
    }

    public boolean acceptsPostings() {
        return active && postingAllowed;
    }

    public AccountProperties.AccountPropertiesBuilder toProperties() {
        return AccountProperties.builder()
            .tenantId(tenantId)
            .accountCode(accountCode)
            .accountName(accountName)
            .accountType(accountType)
            .specialAccountType(specialAccountType)
            .parentAccountCode(parentAccountCode)
            .active(active)
            .postingAllowed(postingAllowed)
            .currency(currency)
            .balance(balance)
            .companionLinks(companionLinks)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .deactivatedAt(deactivatedAt);
    }

    // ---- validation --------------------------------------------------------

    private void validate() {
        validateStructure();
        validatePolarity();
    }

    private void validateStructure() {
        if (isBlank(tenantId)) {
            throw new ValidationException("Tenant ID is required");
        }
        if (isBlank(accountCode)) {
            throw new ValidationException("Account code is required");
        }
        if (isBlank(accountName)) {
            throw new ValidationException("Account name is required");
        }
        if (!ACCOUNT_CODE.matcher(accountCode).matches()) {
            throw new ValidationException(
                "Account code must be 3-20 uppercase alphanumeric characters: " + accountCode);
        }
        if (accountType == null) {
            throw new ValidationException("Account type is required");
        }
        if (accountCode.equals(parentAccountCode)) {
            throw new ValidationException("Parent account code cannot equal account code: " + accountCode);
        }
        if (currency == null) {
            throw new ValidationException("Account currency is required");
        }
        if (createdAt == null) {
            throw new ValidationException("createdAt is required");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new ValidationException("updatedAt cannot be earlier than createdAt");
        }
        if (balance.getCurrency() != currency) {
            throw new ValidationException(String.format(
                "Balance currency %s does not match account currency %s", balance.getCurrency(), currency));
        }
        if (balance.getAmount().scale() > currency.getMinorUnits()) {
            throw new ValidationException("Balance must have at most " + currency.getMinorUnits() + " decimal places");
        }
        validateSpecials();
        validateCompanionLinks();
    }

    private void validateSpecials() {
        AccountType required = specialAccountType.getRequiredBaseType();
        if (required != null && required != accountType) {
            throw new ValidationException(String.format(
                "%s accounts must be of base type %s, got %s", specialAccountType, required, accountType));
        }
        if (specialAccountType == SpecialAccountType.CLEARING && !postingAllowed) {
            throw new ValidationException("Clearing accounts must allow postings");
        }
    }

    private void validateCompanionLinks() {
        for (String target : companionLinks.targets().values()) {
            if (!ACCOUNT_CODE.matcher(target).matches()) {
                throw new ValidationException("Companion link is not a valid account code: " + target);
            }
            if (target.equals(accountCode)) {
                throw new ValidationException("Account " + accountCode + " cannot be its own companion");
            }
        }
    }

    private void validatePolarity() {
        NormalBalance normal = getNormalBalance();
        if (!normal.permits(balance)) {
            throw new PolarityViolationException(String.format(
                "%s-normal account %s cannot hold balance %s",
                normal == NormalBalance.DEBIT ? "Debit" : "Credit", accountCode, balance));
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
