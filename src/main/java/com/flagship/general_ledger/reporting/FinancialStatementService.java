package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodGate;
import com.flagship.general_ledger.store.LedgerSnapshot;
import com.flagship.general_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Profit and loss, balance sheet and cash flow statements.
 *
 * All statements are expressed in the configured reporting currency; accounts
 * held in any other currency are listed as excluded rather than converted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialStatementService {

    private final LedgerStore ledgerStore;
    private final PeriodGate periodGate;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Revenue and expense activity of entries posted within the period's
     * dates. Closing entries are left out so closing the books does not zero
     * the statement.
     */
    public ProfitAndLossStatement getProfitAndLoss(String tenantId, String periodId) {
        AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
        CurrencyCode currency = properties.getReportingCurrency();
        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId, period.getEndDate());
        Map<String, Account> accounts = snapshot.accountsByCode();

        Map<String, Money> activity = new TreeMap<>();
        for (JournalEntry entry : snapshot.getEntries()) {
            if (!period.contains(entry.getPostingDate()) || entry.getEntryKind() == EntryKind.CLOSING) {
                continue;
            }
            for (JournalEntryLine line : entry.getLines()) {
                Account account = accounts.get(line.getAccountCode());
                if (account != null && isIncomeStatement(account) && account.getCurrency() == currency
                    && BalanceReplayer.settlesIn(line, currency)) {
                    activity.merge(account.getAccountCode(), line.signedSettlementAmount(), Money::add);
                }
            }
        }

        List<StatementLine> revenue = new ArrayList<>();
        List<StatementLine> expenses = new ArrayList<>();
        Money totalRevenue = Money.zero(currency);
        Money totalExpenses = Money.zero(currency);
        for (Map.Entry<String, Money> entry : activity.entrySet()) {
            Account account = accounts.get(entry.getKey());
            if (account.getAccountType() == AccountType.REVENUE) {
                Money amount = entry.getValue().negate();
                revenue.add(new StatementLine(account.getAccountCode(), account.getAccountName(), amount));
                totalRevenue = totalRevenue.add(amount);
            } else {
                Money amount = entry.getValue();
                expenses.add(new StatementLine(account.getAccountCode(), account.getAccountName(), amount));
                totalExpenses = totalExpenses.add(amount);
            }
        }

        return ProfitAndLossStatement.builder()
            .tenantId(tenantId)
            .periodId(periodId)
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .currency(currency)
            .revenue(revenue)
            .expenses(expenses)
            .totalRevenue(totalRevenue)
            .totalExpenses(totalExpenses)
            .netIncome(totalRevenue.subtract(totalExpenses))
            .excludedAccounts(excluded(snapshot.getAccounts(), currency, this::isIncomeStatement))
            .generatedAt(clock.instant())
            .build();
    }

    /**
     * Balance sheet from stored balances when {@code asOfDate} is null,
     * otherwise from balances replayed up to that date.
     */
    public BalanceSheet getBalanceSheet(String tenantId, LocalDate asOfDate) {
        CurrencyCode currency = properties.getReportingCurrency();
        BalanceSource source = asOfDate == null ? BalanceSource.STORED : BalanceSource.REPLAY;
        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId, asOfDate);

        Map<String, Money> balances;
        if (source == BalanceSource.REPLAY) {
            balances = BalanceReplayer.replay(snapshot.getAccounts(), snapshot.getEntries()).getBalances();
        } else {
            balances = snapshot.getAccounts().stream()
                .collect(Collectors.toMap(Account::getAccountCode, Account::getBalance, (a, b) -> a, TreeMap::new));
        }

        List<StatementLine> assets = new ArrayList<>();
        List<StatementLine> liabilities = new ArrayList<>();
        List<StatementLine> equity = new ArrayList<>();
        Money totalAssets = Money.zero(currency);
        Money totalLiabilities = Money.zero(currency);
        Money totalEquity = Money.zero(currency);
        Money currentEarnings = Money.zero(currency);

        for (Account account : snapshot.getAccounts()) {
            if (account.getCurrency() != currency) {
                continue;
            }
            Money balance = balances.getOrDefault(account.getAccountCode(), Money.zero(currency));
            switch (account.getAccountType()) {
                case ASSET -> {
                    assets.add(new StatementLine(account.getAccountCode(), account.getAccountName(), balance));
                    totalAssets = totalAssets.add(balance);
                }
                case LIABILITY -> {
                    liabilities.add(new StatementLine(account.getAccountCode(), account.getAccountName(), balance.negate()));
                    totalLiabilities = totalLiabilities.add(balance.negate());
                }
                case EQUITY -> {
                    equity.add(new StatementLine(account.getAccountCode(), account.getAccountName(), balance.negate()));
                    totalEquity = totalEquity.add(balance.negate());
                }
                case REVENUE, EXPENSE -> currentEarnings = currentEarnings.add(balance.negate());
            }
        }

        Money totalLiabilitiesAndEquity = totalLiabilities.add(totalEquity).add(currentEarnings);
        boolean balanced = totalAssets.equals(totalLiabilitiesAndEquity);
        if (!balanced) {
            log.warn("Balance sheet does not balance: tenantId={}, asOf={}, assets={}, liabilitiesAndEquity={}",
                tenantId, asOfDate, totalAssets, totalLiabilitiesAndEquity);
        }

        return BalanceSheet.builder()
            .tenantId(tenantId)
            .asOfDate(asOfDate)
            .source(source)
            .currency(currency)
            .assets(assets)
            .liabilities(liabilities)
            .equity(equity)
            .totalAssets(totalAssets)
            .totalLiabilities(totalLiabilities)
            .totalEquity(totalEquity)
            .currentEarnings(currentEarnings)
            .totalLiabilitiesAndEquity(totalLiabilitiesAndEquity)
            .balanced(balanced)
            .excludedAccounts(excluded(snapshot.getAccounts(), currency, account -> true))
            .generatedAt(clock.instant())
            .build();
    }

    /**
     * Movements of CASH accounts during the period, each classified by the
     * largest non-cash line of its entry.
     */
    public CashFlowStatement getCashFlowStatement(String tenantId, String periodId) {
        AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
        CurrencyCode currency = properties.getReportingCurrency();
        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId, period.getEndDate());
        Map<String, Account> accounts = snapshot.accountsByCode();

        Set<String> cashAccounts = snapshot.getAccounts().stream()
            .filter(account -> account.getSpecialAccountType() == SpecialAccountType.CASH)
            .filter(account -> account.getCurrency() == currency)
            .map(Account::getAccountCode)
            .collect(Collectors.toCollection(TreeSet::new));

        Money beginningCash = Money.zero(currency);
        Money endingCash = Money.zero(currency);
        List<CashFlowItem> operating = new ArrayList<>();
        List<CashFlowItem> investing = new ArrayList<>();
        List<CashFlowItem> financing = new ArrayList<>();

        for (JournalEntry entry : snapshot.getEntries()) {
            Money cashDelta = Money.zero(currency);
            for (JournalEntryLine line : entry.getLines()) {
                if (cashAccounts.contains(line.getAccountCode()) && BalanceReplayer.settlesIn(line, currency)) {
                    cashDelta = cashDelta.add(line.signedSettlementAmount());
                }
            }
            endingCash = endingCash.add(cashDelta);
            if (entry.getPostingDate().isBefore(period.getStartDate())) {
                beginningCash = beginningCash.add(cashDelta);
                continue;
            }
            if (cashDelta.isZero()) {
                continue;
            }

            Optional<JournalEntryLine> counterLine = entry.getLines().stream()
                .filter(line -> !cashAccounts.contains(line.getAccountCode()))
                .filter(JournalEntryLine::isSettled)
                .max(Comparator.comparing(line -> line.getSettlementAmount().getAmount()));
            String counterCode = counterLine.map(JournalEntryLine::getAccountCode).orElse(null);
            CashFlowCategory category = CashFlowCategory.classify(counterCode != null ? accounts.get(counterCode) : null);

            CashFlowItem item = new CashFlowItem(entry.getJournalEntryId(), entry.getPostingDate(),
                entry.getDescription(), category, counterCode, cashDelta);
            switch (category) {
                case OPERATING -> operating.add(item);
                case INVESTING -> investing.add(item);
                case FINANCING -> financing.add(item);
            }
        }

        Money netOperating = sum(operating, currency);
        Money netInvesting = sum(investing, currency);
        Money netFinancing = sum(financing, currency);
        Money netChange = netOperating.add(netInvesting).add(netFinancing);

        return CashFlowStatement.builder()
            .tenantId(tenantId)
            .periodId(periodId)
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .currency(currency)
            .cashAccounts(List.copyOf(cashAccounts))
            .operatingActivities(operating)
            .investingActivities(investing)
            .financingActivities(financing)
            .netCashFromOperating(netOperating)
            .netCashFromInvesting(netInvesting)
            .netCashFromFinancing(netFinancing)
            .netChangeInCash(netChange)
            .beginningCash(beginningCash)
            .endingCash(endingCash)
            .reconciled(beginningCash.add(netChange).equals(endingCash))
            .generatedAt(clock.instant())
            .build();
    }

    private boolean isIncomeStatement(Account account) {
        return account.getAccountType() == AccountType.REVENUE || account.getAccountType() == AccountType.EXPENSE;
    }

    private static List<String> excluded(List<Account> accounts, CurrencyCode currency,
                                         Predicate<Account> relevant) {
        return accounts.stream()
            .filter(relevant)
            .filter(account -> account.getCurrency() != currency)
            .map(Account::getAccountCode)
            .toList();
    }

    private static Money sum(List<CashFlowItem> items, CurrencyCode currency) {
        Money total = Money.zero(currency);
        for (CashFlowItem item : items) {
            total = total.add(item.getAmount());
        }
        return total;
    }
}
