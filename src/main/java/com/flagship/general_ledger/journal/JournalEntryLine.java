package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One debit or one credit of a journal entry.
 *
 * The amount is kept in the transaction currency for audit. The settlement
 * amount is the same value in the account's currency and is what balances and
 * totals are computed from. It is resolved once, at posting time.
 */
@Value
public class JournalEntryLine {

    String accountCode;
    EntryType side;
    Money amount;
    BigDecimal exchangeRate;
    Money settlementAmount;
    String description;

    private JournalEntryLine(String accountCode, EntryType side, Money amount,
                             BigDecimal exchangeRate, Money settlementAmount, String description) {
        if (accountCode == null || accountCode.isBlank()) {
            throw new ValidationException("Journal line account code is required");
        }
        if (side == null) {
            throw new ValidationException("Journal line side is required");
        }
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException(
                "Journal line amount must be positive for account " + accountCode + ": " + amount);
        }
        if (exchangeRate != null && exchangeRate.signum() <= 0) {
            throw new ValidationException("Exchange rate must be positive: " + exchangeRate);
        }
        if (settlementAmount != null && !settlementAmount.isPositive()) {
            throw new ValidationException(
                "Journal line settlement amount must be positive for account " + accountCode);
        }
        this.accountCode = accountCode.trim();
        this.side = side;
        this.amount = amount;
        this.exchangeRate = exchangeRate;
        this.settlementAmount = settlementAmount;
        this.description = description;
    }

    /**
     * Builds a line from a debit/credit pair. Exactly one side must be
     * positive; the other must be absent or zero. Zero-amount lines are invalid.
     */
    public static JournalEntryLine of(String accountCode, BigDecimal debitAmount, BigDecimal creditAmount,
                                      CurrencyCode currency, BigDecimal exchangeRate, String description) {
        boolean hasDebit = debitAmount != null && debitAmount.signum() != 0;
        boolean hasCredit = creditAmount != null && creditAmount.signum() != 0;
        if ((debitAmount != null && debitAmount.signum() < 0) || (creditAmount != null && creditAmount.signum() < 0)) {
            throw new ValidationException(String.format(
                "Debit and credit amounts cannot be negative (account %s: debit=%s, credit=%s)",
                accountCode, debitAmount, creditAmount));
        }
        if (hasDebit == hasCredit) {
            throw new ValidationException(String.format(
                "Exactly one of debit or credit must be > 0 (account %s: debit=%s, credit=%s)",
                accountCode, debitAmount, creditAmount));
        }
        EntryType side = hasDebit ? EntryType.DEBIT : EntryType.CREDIT;
        Money amount = Money.of(hasDebit ? debitAmount : creditAmount, currency);
        return new JournalEntryLine(accountCode, side, amount, exchangeRate, null, description);
    }

    public static JournalEntryLine debit(String accountCode, Money amount, String description) {
        return new JournalEntryLine(accountCode, EntryType.DEBIT, amount, null, null, description);
    }

    public static JournalEntryLine credit(String accountCode, Money amount, String description) {
        return new JournalEntryLine(accountCode, EntryType.CREDIT, amount, null, null, description);
    }

    /**
     * Rehydrates a stored line. Positivity is still enforced.
     */
    public static JournalEntryLine restore(String accountCode, EntryType side, Money amount,
                                           BigDecimal exchangeRate, Money settlementAmount, String description) {
        return new JournalEntryLine(accountCode, side, amount, exchangeRate, settlementAmount, description);
    }

    public JournalEntryLine withExchangeRate(BigDecimal rate) {
        return new JournalEntryLine(accountCode, side, amount, rate, settlementAmount, description);
    }

    /**
     * Resolves the settlement amount in the account's currency.
     *
     * @throws ValidationException if a cross-currency line has no rate, or
     *         the converted amount rounds to zero
     */
    public JournalEntryLine settleIn(CurrencyCode accountCurrency) {
        Money settled;
        if (amount.getCurrency() == accountCurrency) {
            if (exchangeRate != null && exchangeRate.compareTo(BigDecimal.ONE) != 0) {
                throw new ValidationException(String.format(
                    "Line for account %s is already in %s; exchange rate %s does not apply",
                    accountCode, accountCurrency, exchangeRate.toPlainString()));
            }
            settled = amount;
        } else {
            if (exchangeRate == null) {
                throw new ValidationException(String.format(
                    "Exchange rate required to settle %s into %s for account %s",
                    amount, accountCurrency, accountCode));
            }
            settled = amount.convert(exchangeRate, accountCurrency);
            if (settled.isZero()) {
                throw new ValidationException(String.format(
                    "Line for account %s converts to zero %s", accountCode, accountCurrency));
            }
        }
        return new JournalEntryLine(accountCode, side, amount, exchangeRate, settled, description);
    }

    /**
     * Same line on the opposite side, unresolved, for building a reversal.
     */
    public JournalEntryLine mirrored() {
        String mirroredDescription = description == null ? "Reversal" : "Reversal: " + description;
        return new JournalEntryLine(accountCode, side.opposite(), amount, exchangeRate, null, mirroredDescription);
    }

    public boolean isDebit() {
        return side == EntryType.DEBIT;
    }

    public boolean isCredit() {
        return side == EntryType.CREDIT;
    }

    public boolean isSettled() {
        return settlementAmount != null;
    }

    /**
     * Settlement amount signed debit-positive: the delta this line applies
     * to its account's balance.
     */
    public Money signedSettlementAmount() {
        if (settlementAmount == null) {
            throw new IllegalStateException("Line for account " + accountCode + " has not been settled");
        }
        return isDebit() ? settlementAmount : settlementAmount.negate();
    }
}
