package com.flagship.general_ledger.support;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.CompanionLinks;
import com.flagship.general_ledger.account.CreateAccountCommand;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.integrity.IntegrityService;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.journal.LedgerService;
import com.flagship.general_ledger.journal.PostJournalEntryCommand;
import com.flagship.general_ledger.journal.PostingLockManager;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.InMemoryAccountingPeriodStore;
import com.flagship.general_ledger.period.PeriodCloseService;
import com.flagship.general_ledger.period.PeriodGate;
import com.flagship.general_ledger.period.PeriodType;
import com.flagship.general_ledger.reporting.FinancialStatementService;
import com.flagship.general_ledger.reporting.TrialBalanceService;
import com.flagship.general_ledger.store.InMemoryLedgerStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The whole ledger wired over the in-memory stores, with a clock the test
 * controls and a {@link SimpleMeterRegistry} to assert metrics against.
 */
public class LedgerFixtures {

    public static final String TENANT = "acme";
    public static final Instant START = Instant.parse("2024-01-10T09:00:00Z");
    public static final String JANUARY = "2024-01";
    public static final String FEBRUARY = "2024-02";

    public final MutableClock clock = new MutableClock(START);
    public final LedgerProperties properties = new LedgerProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LedgerMetrics metrics = new LedgerMetrics(meterRegistry);
    public final PostingLockManager lockManager = new PostingLockManager(properties);
    public final InMemoryLedgerStore ledgerStore = new InMemoryLedgerStore();
    public final InMemoryAccountingPeriodStore periodStore = new InMemoryAccountingPeriodStore();
    public final PeriodGate periodGate = new PeriodGate(periodStore, lockManager, properties, metrics, clock);
    public final AccountService accountService =
        new AccountService(ledgerStore, lockManager, properties, metrics, clock);
    public final LedgerService ledgerService =
        new LedgerService(ledgerStore, periodGate, lockManager, properties, metrics, clock);
    public final TrialBalanceService trialBalanceService = new TrialBalanceService(ledgerStore, periodGate, clock);
    public final FinancialStatementService financialStatementService =
        new FinancialStatementService(ledgerStore, periodGate, properties, clock);
    public final IntegrityService integrityService =
        new IntegrityService(ledgerStore, periodGate, trialBalanceService, metrics, clock);
    public final PeriodCloseService periodCloseService =
        new PeriodCloseService(periodGate, integrityService, trialBalanceService, lockManager);

    /**
     * January and February 2024 open, plus a small chart of accounts in USD.
     */
    public static LedgerFixtures withStandardChart() {
        LedgerFixtures fixtures = new LedgerFixtures();
        fixtures.openMonth(1);
        fixtures.openMonth(2);
        fixtures.account("CASH", "Cash at bank", AccountType.ASSET, SpecialAccountType.CASH);
        fixtures.account("ARC", "Accounts receivable", AccountType.ASSET, SpecialAccountType.CONTROL_AR);
        fixtures.account("EQUIP", "Equipment", AccountType.ASSET, SpecialAccountType.NONE);
        fixtures.account("APC", "Accounts payable", AccountType.LIABILITY, SpecialAccountType.CONTROL_AP);
        fixtures.account("LOAN", "Bank loan", AccountType.LIABILITY, SpecialAccountType.NONE);
        fixtures.account("CAPITAL", "Share capital", AccountType.EQUITY, SpecialAccountType.NONE);
        fixtures.account("SALES", "Sales revenue", AccountType.REVENUE, SpecialAccountType.NONE);
        fixtures.account("RENT", "Rent expense", AccountType.EXPENSE, SpecialAccountType.NONE);
        return fixtures;
    }

    public AccountingPeriod openMonth(int month) {
        return periodGate.createPeriod(TENANT, 2024, PeriodType.MONTHLY, month);
    }

    public Account account(String code, String name, AccountType type, SpecialAccountType special) {
        return account(code, name, type, special, CurrencyCode.USD);
    }

    public Account account(String code, String name, AccountType type, SpecialAccountType special,
                           CurrencyCode currency) {
        return accountService.createAccount(CreateAccountCommand.builder()
            .tenantId(TENANT)
            .accountCode(code)
            .accountName(name)
            .accountType(type)
            .specialAccountType(special)
            .currency(currency)
            .companionLinks(CompanionLinks.NONE)
            .build());
    }

    /**
     * Posts a two-line USD entry: debit one account, credit the other.
     */
    public JournalEntry post(String entryId, LocalDate date, String period,
                             String debitAccount, String creditAccount, String amount) {
        return post(entryId, date, period, EntryKind.STANDARD,
            List.of(debit(debitAccount, amount), credit(creditAccount, amount)));
    }

    public JournalEntry post(String entryId, LocalDate date, String period, EntryKind kind,
                             List<JournalEntryLine> lines) {
        JournalEntry posted = ledgerService.post(command(entryId, date, period, kind, lines));
        clock.advance(Duration.ofMinutes(1));
        return posted;
    }

    public static PostJournalEntryCommand command(String entryId, LocalDate date, String period, EntryKind kind,
                                                  List<JournalEntryLine> lines) {
        return PostJournalEntryCommand.builder()
            .tenantId(TENANT)
            .journalEntryId(entryId)
            .postingDate(date)
            .accountingPeriod(period)
            .entryKind(kind)
            .description("Test entry " + entryId)
            .postedBy("tester")
            .lines(lines)
            .build();
    }

    public static JournalEntryLine debit(String accountCode, String amount) {
        return JournalEntryLine.debit(accountCode, Money.of(amount, CurrencyCode.USD), null);
    }

    public static JournalEntryLine credit(String accountCode, String amount) {
        return JournalEntryLine.credit(accountCode, Money.of(amount, CurrencyCode.USD), null);
    }

    public static Money usd(String amount) {
        return Money.of(amount, CurrencyCode.USD);
    }

    public Account storedAccount(String code) {
        return ledgerStore.loadAccount(TENANT, code).orElseThrow();
    }

    /**
     * Overwrites a stored balance behind the engine's back.
     */
    public void tamperBalance(String code, Money balance) {
        Account current = storedAccount(code);
        ledgerStore.saveAccounts(List.of(Account.restore(current.toProperties().balance(balance).build())));
    }

    public static LocalDate jan(int day) {
        return LocalDate.of(2024, 1, day);
    }

    public static LocalDate feb(int day) {
        return LocalDate.of(2024, 2, day);
    }
}
