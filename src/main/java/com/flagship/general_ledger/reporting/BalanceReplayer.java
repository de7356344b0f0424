package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds account balances from journal history.
 *
 * Every known account starts at zero in its own currency. Lines on codes that
 * are not in {@code accounts} are still summed, keyed by the line's code, so
 * callers can report them; such a balance takes the currency of the first
 * line seen for the code.
 *
 * A line that is unsettled, or settled in a currency other than its
 * balance's, cannot be added. It is left out of the balances and listed in
 * {@link Replay#getSkippedLines()} as {@code entryId:accountCode:currency}.
 */
public final class BalanceReplayer {

    private BalanceReplayer() {
    }

    @Value
    public static class Replay {
        Map<String, Money> balances;
        List<String> skippedLines;
    }

    public static Replay replay(Collection<Account> accounts, List<JournalEntry> entries) {
        Map<String, Money> balances = new TreeMap<>();
        List<String> skipped = new ArrayList<>();
        for (Account account : accounts) {
            balances.put(account.getAccountCode(), Money.zero(account.getCurrency()));
        }
        for (JournalEntry entry : entries) {
            for (JournalEntryLine line : entry.getLines()) {
                Money current = balances.get(line.getAccountCode());
                CurrencyCode currency = current != null ? current.getCurrency() : settlementCurrency(line);
                if (!settlesIn(line, currency)) {
                    skipped.add(describe(entry, line));
                    continue;
                }
                balances.merge(line.getAccountCode(), line.signedSettlementAmount(), Money::add);
            }
        }
        return new Replay(balances, skipped);
    }

    /**
     * Signed delta an entry applies to one account; zero when it does not touch it.
     * Lines that do not settle in the account's currency are ignored.
     */
    public static Money deltaFor(JournalEntry entry, Account account) {
        Money delta = Money.zero(account.getCurrency());
        for (JournalEntryLine line : entry.getLines()) {
            if (line.getAccountCode().equals(account.getAccountCode()) && settlesIn(line, account.getCurrency())) {
                delta = delta.add(line.signedSettlementAmount());
            }
        }
        return delta;
    }

    /**
     * True when the line carries a settlement amount in {@code currency}.
     */
    public static boolean settlesIn(JournalEntryLine line, CurrencyCode currency) {
        return line.isSettled() && line.getSettlementAmount().getCurrency() == currency;
    }

    private static CurrencyCode settlementCurrency(JournalEntryLine line) {
        return line.isSettled() ? line.getSettlementAmount().getCurrency() : null;
    }

    private static String describe(JournalEntry entry, JournalEntryLine line) {
        String currency = line.isSettled() ? line.getSettlementAmount().getCurrency().name() : "UNSETTLED";
        return entry.getJournalEntryId() + ":" + line.getAccountCode() + ":" + currency;
    }
}
