package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Value;

/**
 * One account in a trial balance. {@code balance} is signed debit-positive;
 * the debit and credit columns split it into two non-negative amounts.
 */
@Value
public class TrialBalanceLine {
    String accountCode;
    String accountName;
    AccountType accountType;
    SpecialAccountType specialAccountType;
    CurrencyCode currency;
    Money balance;
    Money debitBalance;
    Money creditBalance;
    boolean known;

    public static TrialBalanceLine of(Account account, Money balance) {
        return new TrialBalanceLine(
            account.getAccountCode(),
            account.getAccountName(),
            account.getAccountType(),
            account.getSpecialAccountType(),
            balance.getCurrency(),
            balance,
            balance.isPositive() ? balance : Money.zero(balance.getCurrency()),
            balance.isNegative() ? balance.negate() : Money.zero(balance.getCurrency()),
            true
        );
    }

    /**
     * Line for history posted to a code that has no account.
     */
    public static TrialBalanceLine unknown(String accountCode, Money balance) {
        return new TrialBalanceLine(
            accountCode,
            "Unknown account",
            null,
            null,
            balance.getCurrency(),
            balance,
            balance.isPositive() ? balance : Money.zero(balance.getCurrency()),
            balance.isNegative() ? balance.negate() : Money.zero(balance.getCurrency()),
            false
        );
    }
}
