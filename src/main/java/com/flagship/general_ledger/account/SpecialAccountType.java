package com.flagship.general_ledger.account;

/**
 * Optional refinement of an {@link AccountType}.
 *
 * A special type may pin the base type it requires and may override the
 * polarity the base type implies. {@code null} means "no constraint" for the
 * base type and "inherit" for the polarity.
 */
public enum SpecialAccountType {
    NONE(null, null),

    // Contra & provisioning
    ACCUMULATED_DEPRECIATION(AccountType.ASSET, NormalBalance.CREDIT),
    ALLOWANCE_FOR_DOUBTFUL_ACCOUNTS(AccountType.ASSET, NormalBalance.CREDIT),
    PROVISION(AccountType.LIABILITY, null),

    // Control / system
    CONTROL_RETAINED_EARNINGS(AccountType.EQUITY, null),
    CONTROL_AR(AccountType.ASSET, null),
    CONTROL_AP(AccountType.LIABILITY, null),
    CLEARING(null, NormalBalance.EITHER),
    SUSPENSE(null, NormalBalance.EITHER),
    ROUNDING(null, NormalBalance.EITHER),
    CASH(AccountType.ASSET, null),

    // Tax
    TAX_PAYABLE(AccountType.LIABILITY, null),
    TAX_RECEIVABLE(AccountType.ASSET, null),

    // FX revaluation
    FX_GAIN(AccountType.REVENUE, null),
    FX_LOSS(AccountType.EXPENSE, null),

    // Intercompany
    INTERCO_RECEIVABLE(AccountType.ASSET, null),
    INTERCO_PAYABLE(AccountType.LIABILITY, null),

    DEPRECIATION_EXPENSE(AccountType.EXPENSE, null),

    // Consolidation & group
    ELIMINATION_RESERVE(null, NormalBalance.EITHER),
    CTA_EQUITY(AccountType.EQUITY, NormalBalance.EITHER),
    NCI_EQUITY(AccountType.EQUITY, null),
    GOODWILL(AccountType.ASSET, null),
    UNREALIZED_PROFIT_INVENTORY(AccountType.ASSET, NormalBalance.CREDIT);

    private final AccountType requiredBaseType;
    private final NormalBalance polarityOverride;

    SpecialAccountType(AccountType requiredBaseType, NormalBalance polarityOverride) {
        this.requiredBaseType = requiredBaseType;
        this.polarityOverride = polarityOverride;
    }

    public AccountType getRequiredBaseType() {
        return requiredBaseType;
    }

    public NormalBalance getPolarityOverride() {
        return polarityOverride;
    }

    public boolean isContra() {
        return requiredBaseType != null
            && polarityOverride != null
            && polarityOverride != NormalBalance.EITHER
            && polarityOverride != requiredBaseType.getNormalBalance();
    }
}
