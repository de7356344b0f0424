package com.flagship.general_ledger.account;

import com.flagship.general_ledger.money.Money;

/**
 * Expected sign of an account balance. Balances are signed debit-positive.
 */
public enum NormalBalance {
    DEBIT,
    CREDIT,
    EITHER;

    public boolean permits(Money balance) {
        return switch (this) {
            case DEBIT -> balance.signum() >= 0;
            case CREDIT -> balance.signum() <= 0;
            case EITHER -> true;
        };
    }
}
