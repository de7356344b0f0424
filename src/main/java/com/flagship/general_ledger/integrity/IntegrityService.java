package com.flagship.general_ledger.integrity;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodGate;
import com.flagship.general_ledger.reporting.BalanceReplayer;
import com.flagship.general_ledger.reporting.CurrencyTotals;
import com.flagship.general_ledger.reporting.TrialBalance;
import com.flagship.general_ledger.reporting.TrialBalanceLine;
import com.flagship.general_ledger.reporting.TrialBalanceService;
import com.flagship.general_ledger.store.LedgerSnapshot;
import com.flagship.general_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares stored balances with journal history and reports anything that
 * does not add up.
 *
 * Every operation returns a report; nothing here throws on bad data. Callers
 * that must stop on drift (period close) decide that themselves.
 */
@Slf4j
@Service
public class IntegrityService {

    private final LedgerStore ledgerStore;
    private final PeriodGate periodGate;
    private final TrialBalanceService trialBalanceService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public IntegrityService(LedgerStore ledgerStore, PeriodGate periodGate, TrialBalanceService trialBalanceService,
                            LedgerMetrics metrics, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.periodGate = periodGate;
        this.trialBalanceService = trialBalanceService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Replays the tenant's full history and compares every account with its
     * stored balance. Also reports stored polarity violations and lines
     * naming accounts that do not exist.
     */
    public IntegrityReport validateGLIntegrity(String tenantId) {
        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId, null);
        Map<String, Account> accounts = snapshot.accountsByCode();
        BalanceReplayer.Replay replay = BalanceReplayer.replay(accounts.values(), snapshot.getEntries());
        Map<String, Money> replayed = replay.getBalances();

        IntegrityReport.IntegrityReportBuilder report = IntegrityReport.builder()
            .tenantId(tenantId)
            .checkedAt(clock.instant())
            .accountsChecked(accounts.size())
            .entriesChecked(snapshot.getEntries().size())
            .currencyMismatches(replay.getSkippedLines());

        int driftCount = 0;
        for (Account account : accounts.values()) {
            Money expected = replayed.get(account.getAccountCode());
            Money actual = account.getBalance();
            if (!actual.equals(expected)) {
                Money difference = actual.subtract(expected);
                report.drift(new BalanceDrift(account.getAccountCode(), expected, actual, difference,
                    findOffendingEntry(snapshot.getEntries(), account, difference)));
                driftCount++;
            }
            if (!account.hasValidPolarity()) {
                report.polarityViolation(account.getAccountCode());
            }
        }

        for (JournalEntry entry : snapshot.getEntries()) {
            for (JournalEntryLine line : entry.getLines()) {
                if (!accounts.containsKey(line.getAccountCode())) {
                    report.unknownAccountReference(entry.getJournalEntryId() + ":" + line.getAccountCode());
                }
            }
        }

        IntegrityReport result = report.build();
        metrics.recordIntegrityDrifts(driftCount);
        if (result.isHealthy()) {
            log.info("GL integrity check passed: tenantId={}, accounts={}, entries={}",
                tenantId, result.getAccountsChecked(), result.getEntriesChecked());
        } else {
            log.warn("GL integrity check found issues: tenantId={}, drifts={}, polarity={}, unknownAccounts={}, "
                    + "currencyMismatches={}",
                tenantId, result.getDrifts().size(), result.getPolarityViolations().size(),
                result.getUnknownAccountReferences().size(), result.getCurrencyMismatches().size());
        }
        return result;
    }

    /**
     * Compares the trial balance as of the period end with the caller's
     * expected balances. Accounts missing from {@code expectedBalances} are
     * expected to be zero. Without expected balances, integrity drifts are
     * reported as the variances.
     *
     * @throws com.flagship.general_ledger.exception.ValidationException if the period does not exist
     */
    public ReconciliationReport reconcileTrialBalance(String tenantId, String periodId,
                                                      Map<String, BigDecimal> expectedBalances) {
        AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
        ReconciliationReport.ReconciliationReportBuilder report = ReconciliationReport.builder()
            .tenantId(tenantId)
            .periodId(periodId)
            .asOfDate(period.getEndDate())
            .generatedAt(clock.instant());

        if (expectedBalances == null || expectedBalances.isEmpty()) {
            IntegrityReport integrity = validateGLIntegrity(tenantId);
            Map<String, Account> accounts = ledgerStore.loadSnapshot(tenantId, null).accountsByCode();
            for (BalanceDrift drift : integrity.getDrifts()) {
                Account account = accounts.get(drift.getAccountCode());
                report.variance(Variance.of(drift.getAccountCode(),
                    account != null ? account.getAccountName() : null,
                    drift.getExpected().getAmount(), drift.getActual().getAmount()));
            }
            if (!integrity.isHealthy()) {
                report.recommendation("Review GL integrity issues before proceeding with reconciliation");
            }
            return report.build();
        }

        TrialBalance trialBalance = trialBalanceService.computeTrialBalance(tenantId, periodId, period.getEndDate());
        Set<String> seen = new HashSet<>();
        int critical = 0;
        int high = 0;
        for (TrialBalanceLine line : trialBalance.getLines()) {
            seen.add(line.getAccountCode());
            BigDecimal expected = expectedBalances.getOrDefault(line.getAccountCode(), BigDecimal.ZERO);
            BigDecimal actual = line.getBalance().getAmount();
            if (actual.compareTo(expected) != 0) {
                Variance variance = Variance.of(line.getAccountCode(), line.getAccountName(), expected, actual);
                report.variance(variance);
                critical += variance.getSeverity() == Severity.CRITICAL ? 1 : 0;
                high += variance.getSeverity() == Severity.HIGH ? 1 : 0;
            }
        }
        for (Map.Entry<String, BigDecimal> expected : expectedBalances.entrySet()) {
            if (!seen.contains(expected.getKey()) && expected.getValue().signum() != 0) {
                Variance variance = Variance.of(expected.getKey(), null, expected.getValue(), BigDecimal.ZERO);
                report.variance(variance);
                critical += variance.getSeverity() == Severity.CRITICAL ? 1 : 0;
                high += variance.getSeverity() == Severity.HIGH ? 1 : 0;
            }
        }

        ReconciliationReport partial = report.build();
        if (critical > 0) {
            report.recommendation(String.format(
                "Immediate attention required: %d critical variances found", critical));
        }
        if (high > 0) {
            report.recommendation(String.format(
                "High priority review: %d high-severity variances found", high));
        }
        if (!partial.getVariances().isEmpty()) {
            report.recommendation("Review journal entries for the affected accounts");
            report.recommendation("Verify account balances against source documents");
            report.recommendation("Consider implementing automated balance validation rules");
        }
        return report.build();
    }

    /**
     * Everything that needs a human: unbalanced entries, broken companion
     * links, postings that bypassed account rules, drift, polarity problems
     * and trial balance imbalance as of the period end.
     */
    public ExceptionReport generateExceptionReport(String tenantId, String periodId) {
        AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
        LedgerSnapshot snapshot = ledgerStore.loadSnapshot(tenantId, null);
        Map<String, Account> accounts = snapshot.accountsByCode();

        ExceptionReport.ExceptionReportBuilder report = ExceptionReport.builder()
            .tenantId(tenantId)
            .periodId(periodId)
            .generatedAt(clock.instant());

        for (JournalEntry entry : snapshot.getEntries()) {
            if (!entry.isBalanced()) {
                report.exception(new ExceptionItem(ExceptionType.UNBALANCED_ENTRY, Severity.CRITICAL,
                    String.format("Journal entry %s does not balance: debits=%s, credits=%s",
                        entry.getJournalEntryId(), entry.debitTotals().values(), entry.creditTotals().values()),
                    null, entry.getJournalEntryId(),
                    "Reverse the entry and repost it with balanced lines"));
            }
            reportPostingBypasses(entry, accounts, report);
        }

        for (Account account : accounts.values()) {
            reportCompanionLinks(account, accounts, report);
        }

        IntegrityReport integrity = validateGLIntegrity(tenantId);
        for (BalanceDrift drift : integrity.getDrifts()) {
            report.exception(new ExceptionItem(ExceptionType.BALANCE_DRIFT, Severity.HIGH,
                String.format("Stored balance %s differs from journal balance %s by %s",
                    drift.getActual(), drift.getExpected(), drift.getDifference()),
                drift.getAccountCode(), drift.getFirstOffendingEntryId(),
                "Investigate direct changes to the account and restore the journal balance"));
        }
        for (String mismatch : integrity.getCurrencyMismatches()) {
            String[] parts = mismatch.split(":");
            report.exception(new ExceptionItem(ExceptionType.CURRENCY_MISMATCH, Severity.HIGH,
                "Journal line does not settle in its account currency: " + mismatch,
                parts[1], parts[0], "Reverse the entry and repost it settled in the account currency"));
        }
        for (String accountCode : integrity.getPolarityViolations()) {
            report.exception(new ExceptionItem(ExceptionType.POLARITY_VIOLATION, Severity.HIGH,
                "Account " + accountCode + " holds a balance of the wrong sign",
                accountCode, null, "Review account balance polarity rules"));
        }

        TrialBalance trialBalance = trialBalanceService.computeTrialBalance(tenantId, periodId, period.getEndDate());
        for (CurrencyTotals totals : trialBalance.getTotals()) {
            if (!totals.isBalanced()) {
                report.exception(new ExceptionItem(ExceptionType.TRIAL_BALANCE_IMBALANCE, Severity.CRITICAL,
                    String.format("Trial balance as of %s is off by %s", period.getEndDate(), totals.getDifference()),
                    null, null, "Review and correct the entries causing the imbalance"));
            }
        }
        for (String warning : trialBalance.getWarnings()) {
            report.exception(new ExceptionItem(ExceptionType.WARNING, Severity.MEDIUM, warning, null, null,
                "Review account balances for potential issues"));
        }

        ExceptionReport result = report.build();
        log.info("Exception report generated: tenantId={}, periodId={}, exceptions={}, requiresAttention={}",
            tenantId, periodId, result.getTotalExceptions(), result.requiresAttention());
        return result;
    }

    /**
     * A posting to an inactive account is a bypass when it was made at or
     * after the deactivation. Header accounts never accept postings, so any
     * posting made once the account existed is one.
     */
    private void reportPostingBypasses(JournalEntry entry, Map<String, Account> accounts,
                                       ExceptionReport.ExceptionReportBuilder report) {
        Set<String> reported = new HashSet<>();
        for (JournalEntryLine line : entry.getLines()) {
            String code = line.getAccountCode();
            if (!reported.add(code)) {
                continue;
            }
            Account account = accounts.get(code);
            if (account == null) {
                report.exception(new ExceptionItem(ExceptionType.POSTING_TO_UNKNOWN_ACCOUNT, Severity.HIGH,
                    "Entry " + entry.getJournalEntryId() + " posts to unknown account " + code,
                    code, entry.getJournalEntryId(), "Create the account or reclassify the line"));
                continue;
            }
            Instant postedAt = entry.getPostedAt();
            if (!account.isActive() && postedAt != null && postedWhileInactive(postedAt, account)) {
                report.exception(new ExceptionItem(ExceptionType.POSTING_TO_INACTIVE_ACCOUNT, Severity.HIGH,
                    "Entry " + entry.getJournalEntryId() + " posts to inactive account " + code,
                    code, entry.getJournalEntryId(), "Reclassify the line to an active account"));
            }
            if (!account.isPostingAllowed() && postedAt != null
                && (account.getCreatedAt() == null || !postedAt.isBefore(account.getCreatedAt()))) {
                report.exception(new ExceptionItem(ExceptionType.POSTING_TO_NON_POSTING_ACCOUNT, Severity.HIGH,
                    "Entry " + entry.getJournalEntryId() + " posts to header account " + code,
                    code, entry.getJournalEntryId(), "Reclassify the line to a posting account"));
            }
        }
    }

    /**
     * Accounts stored before deactivation was stamped fall back to their last
     * update.
     */
    private boolean postedWhileInactive(Instant postedAt, Account account) {
        if (account.getDeactivatedAt() != null) {
            return !postedAt.isBefore(account.getDeactivatedAt());
        }
        return postedAt.isAfter(account.getUpdatedAt());
    }

    private void reportCompanionLinks(Account account, Map<String, Account> accounts,
                                      ExceptionReport.ExceptionReportBuilder report) {
        for (Map.Entry<SpecialAccountType, String> link : account.getCompanionLinks().targets().entrySet()) {
            Account target = accounts.get(link.getValue());
            if (target == null) {
                report.exception(new ExceptionItem(ExceptionType.ORPHANED_COMPANION_LINK, Severity.HIGH,
                    String.format("Account %s links to missing %s account %s",
                        account.getAccountCode(), link.getKey(), link.getValue()),
                    account.getAccountCode(), null, "Create the companion account or remove the link"));
            } else if (target.getSpecialAccountType() != link.getKey()) {
                report.exception(new ExceptionItem(ExceptionType.COMPANION_TYPE_MISMATCH, Severity.MEDIUM,
                    String.format("Account %s links to %s as %s but it is %s",
                        account.getAccountCode(), link.getValue(), link.getKey(), target.getSpecialAccountType()),
                    account.getAccountCode(), null, "Point the link at an account of the expected type"));
            }
        }
    }

    private String findOffendingEntry(List<JournalEntry> entries, Account account, Money difference) {
        Money reverse = difference.negate();
        for (JournalEntry entry : entries) {
            Money delta = BalanceReplayer.deltaFor(entry, account);
            if (!delta.isZero() && (delta.equals(difference) || delta.equals(reverse))) {
                return entry.getJournalEntryId();
            }
        }
        return null;
    }
}
