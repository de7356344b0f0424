package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodGate;
import com.flagship.general_ledger.store.LedgerSnapshot;
import com.flagship.general_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds trial balances from a consistent snapshot of accounts and history.
 *
 * Read-only: never takes the posting lock and never writes.
 */
@Slf4j
@Service
public class TrialBalanceService {

    static final BigDecimal LARGE_BALANCE_THRESHOLD = new BigDecimal("1000000");

    private final LedgerStore ledgerStore;
    private final PeriodGate periodGate;
    private final Clock clock;

    public TrialBalanceService(LedgerStore ledgerStore, PeriodGate periodGate, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.periodGate = periodGate;
        this.clock = clock;
    }

    /**
     * Stored balances when {@code asOfDate} is null, otherwise balances
     * replayed from lines posted on or before {@code asOfDate}.
     */
    public TrialBalance computeTrialBalance(String tenantId, String periodId, LocalDate asOfDate) {
        return computeTrialBalance(tenantId, periodId, asOfDate,
            asOfDate == null ? BalanceSource.STORED : BalanceSource.REPLAY);
    }

    /**
     * @param periodId optional; must exist when given. A replay without
     *        {@code asOfDate} runs to the period's end date.
     * @throws com.flagship.general_ledger.exception.ValidationException if the period does not exist
     */
    public TrialBalance computeTrialBalance(String tenantId, String periodId, LocalDate asOfDate,
                                            BalanceSource source) {
        LocalDate effectiveDate = asOfDate;
        if (periodId != null) {
            AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
            if (effectiveDate == null && source == BalanceSource.REPLAY) {
                effectiveDate = period.getEndDate();
            }
        }

        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId,
            source == BalanceSource.REPLAY ? effectiveDate : null);
        return build(snapshot, periodId, effectiveDate, source);
    }

    /**
     * Builds a trial balance from an already loaded snapshot.
     */
    public TrialBalance build(LedgerSnapshot snapshot, String periodId, LocalDate asOfDate, BalanceSource source) {
        Map<String, Account> accounts = snapshot.accountsByCode();
        TrialBalance.TrialBalanceBuilder builder = TrialBalance.builder()
            .tenantId(snapshot.getTenantId())
            .periodId(periodId)
            .asOfDate(asOfDate)
            .source(source)
            .generatedAt(clock.instant());

        Map<String, Money> balances;
        if (source == BalanceSource.STORED) {
            balances = new TreeMap<>();
            for (Account account : accounts.values()) {
                balances.put(account.getAccountCode(), account.getBalance());
            }
        } else {
            BalanceReplayer.Replay replay = BalanceReplayer.replay(accounts.values(), snapshot.getEntries());
            balances = replay.getBalances();
            replay.getSkippedLines().forEach(ref ->
                builder.finding("Journal line does not settle in its account currency: " + ref));
        }

        Map<CurrencyCode, Money> debitTotals = new EnumMap<>(CurrencyCode.class);
        Map<CurrencyCode, Money> creditTotals = new EnumMap<>(CurrencyCode.class);
        int zeroBalances = 0;
        int largeBalances = 0;

        for (Map.Entry<String, Money> balance : balances.entrySet()) {
            Account account = accounts.get(balance.getKey());
            TrialBalanceLine line;
            if (account != null) {
                line = TrialBalanceLine.of(account, balance.getValue());
                if (!account.getNormalBalance().permits(balance.getValue())) {
                    builder.warning(String.format("%s account %s has a %s balance of %s",
                        account.getAccountType(), account.getAccountCode(),
                        balance.getValue().isNegative() ? "credit" : "debit", balance.getValue().abs()));
                }
            } else {
                line = TrialBalanceLine.unknown(balance.getKey(), balance.getValue());
                builder.finding("Journal lines reference unknown account " + balance.getKey());
            }
            builder.line(line);

            CurrencyCode currency = line.getCurrency();
            debitTotals.merge(currency, line.getDebitBalance(), Money::add);
            creditTotals.merge(currency, line.getCreditBalance(), Money::add);
            if (line.getBalance().isZero()) {
                zeroBalances++;
            }
            if (line.getBalance().getAmount().abs().compareTo(LARGE_BALANCE_THRESHOLD) > 0) {
                largeBalances++;
            }
        }

        boolean balanced = true;
        List<CurrencyTotals> totals = new ArrayList<>();
        for (CurrencyCode currency : debitTotals.keySet()) {
            CurrencyTotals total = CurrencyTotals.of(currency, debitTotals.get(currency), creditTotals.get(currency));
            totals.add(total);
            if (!total.isBalanced()) {
                balanced = false;
                builder.finding(String.format(
                    "Trial balance is not balanced in %s: debits=%s, credits=%s, difference=%s",
                    currency, total.getTotalDebits().getAmount().toPlainString(),
                    total.getTotalCredits().getAmount().toPlainString(),
                    total.getDifference().getAmount().toPlainString()));
            }
        }
        if (zeroBalances > 0) {
            builder.warning(zeroBalances + " accounts have zero balances");
        }
        if (largeBalances > 0) {
            builder.warning(String.format("%d accounts have unusually large balances (>%s)",
                largeBalances, LARGE_BALANCE_THRESHOLD.toPlainString()));
        }

        TrialBalance trialBalance = builder.totals(totals).balanced(balanced).build();
        if (!balanced) {
            log.warn("Trial balance not balanced: tenantId={}, source={}, asOf={}, findings={}",
                snapshot.getTenantId(), source, asOfDate, trialBalance.getFindings());
        }
        return trialBalance;
    }
}
