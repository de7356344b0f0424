package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ReversalException;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable record of a posted journal entry.
 *
 * Instances are built by the ledger engine after every check has passed, or
 * rehydrated from storage. Rehydration does not re-check the balance so that
 * a corrupt stored record can still be read and reported.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {

    String tenantId;
    String journalEntryId;
    @Singular
    List<JournalEntryLine> lines;
    String reference;
    String description;
    LocalDate postingDate;
    String accountingPeriod;
    EntryKind entryKind;
    String postedBy;
    Instant postedAt;

    // Reversal linkage
    String reversalOf;
    String reversedBy;
    String reversalReason;

    public JournalEntryStatus getStatus() {
        return reversedBy != null ? JournalEntryStatus.REVERSED : JournalEntryStatus.POSTED;
    }

    public boolean isReversed() {
        return reversedBy != null;
    }

    public boolean isReversal() {
        return reversalOf != null;
    }

    /**
     * Links this entry to the entry that reverses it. The link is set once.
     */
    public JournalEntry markReversedBy(String reversalEntryId) {
        if (reversedBy != null) {
            throw new ReversalException(String.format(
                "Journal entry %s already reversed by %s", journalEntryId, reversedBy));
        }
        return toBuilder().reversedBy(reversalEntryId).build();
    }

    public Map<CurrencyCode, Money> debitTotals() {
        return totals(EntryType.DEBIT);
    }

    public Map<CurrencyCode, Money> creditTotals() {
        return totals(EntryType.CREDIT);
    }

    /**
     * True when debits equal credits in every settlement currency.
     */
    public boolean isBalanced() {
        Map<CurrencyCode, Money> debits = debitTotals();
        Map<CurrencyCode, Money> credits = creditTotals();
        Set<CurrencyCode> currencies = new LinkedHashSet<>(debits.keySet());
        currencies.addAll(credits.keySet());
        for (CurrencyCode currency : currencies) {
            Money debit = debits.getOrDefault(currency, Money.zero(currency));
            Money credit = credits.getOrDefault(currency, Money.zero(currency));
            if (!debit.equals(credit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Net signed delta per account code, in ascending code order.
     */
    public Map<String, Money> deltasByAccount() {
        Map<String, Money> deltas = new TreeMap<>();
        for (JournalEntryLine line : lines) {
            deltas.merge(line.getAccountCode(), line.signedSettlementAmount(), Money::add);
        }
        return deltas;
    }

    public Set<String> accountCodes() {
        Set<String> codes = new LinkedHashSet<>();
        lines.forEach(line -> codes.add(line.getAccountCode()));
        return codes;
    }

    private Map<CurrencyCode, Money> totals(EntryType side) {
        Map<CurrencyCode, Money> totals = new EnumMap<>(CurrencyCode.class);
        for (JournalEntryLine line : lines) {
            if (line.getSide() == side && line.isSettled()) {
                Money amount = line.getSettlementAmount();
                totals.merge(amount.getCurrency(), amount, Money::add);
            }
        }
        return totals;
    }
}
