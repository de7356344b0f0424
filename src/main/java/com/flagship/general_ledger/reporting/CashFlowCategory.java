package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;

/**
 * Cash flow section, decided by the account on the other side of a cash
 * movement.
 */
public enum CashFlowCategory {
    OPERATING,
    INVESTING,
    FINANCING;

    /**
     * Revenue, expense and working-capital accounts are operating; other
     * assets are investing; other liabilities and equity are financing.
     * Unknown counter accounts count as operating.
     */
    public static CashFlowCategory classify(Account counterAccount) {
        if (counterAccount == null) {
            return OPERATING;
        }
        boolean workingCapital = switch (counterAccount.getSpecialAccountType()) {
            case CONTROL_AR, CONTROL_AP, TAX_PAYABLE, TAX_RECEIVABLE, PROVISION, ALLOWANCE_FOR_DOUBTFUL_ACCOUNTS,
                INTERCO_RECEIVABLE, INTERCO_PAYABLE, CLEARING, SUSPENSE, ROUNDING, FX_GAIN, FX_LOSS -> true;
            default -> false;
        };
        if (workingCapital) {
            return OPERATING;
        }
        AccountType type = counterAccount.getAccountType();
        if (type == AccountType.REVENUE || type == AccountType.EXPENSE) {
            return OPERATING;
        }
        if (type == AccountType.ASSET) {
            return INVESTING;
        }
        return FINANCING;
    }
}
