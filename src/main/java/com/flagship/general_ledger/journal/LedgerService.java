package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.exception.AccountInactiveException;
import com.flagship.general_ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.exception.DuplicateEntryException;
import com.flagship.general_ledger.exception.ImbalanceException;
import com.flagship.general_ledger.exception.LedgerException;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.exception.PostingNotAllowedException;
import com.flagship.general_ledger.exception.ReversalException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodGate;
import com.flagship.general_ledger.store.LedgerStore;
import com.flagship.general_ledger.store.PostingBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Journal entry engine: posts and reverses entries.
 *
 * This service enforces the core invariants:
 * 1. Debits equal credits per settlement currency
 * 2. Only periods and accounts that accept the entry are touched
 * 3. Every balance change goes through {@link Account#applyDelta}, so polarity holds
 * 4. Balances and the journal record are written in one atomic store call
 *
 * Checks run in a fixed order, all before any write: structure, then (inside
 * the tenant's posting section) period, accounts, balance, duplicate id,
 * polarity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerStore ledgerStore;
    private final PeriodGate periodGate;
    private final PostingLockManager lockManager;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Posts a journal entry.
     *
     * @return the stored entry with settled lines and posting timestamp
     * @throws ValidationException for structural problems, unknown periods and dates outside the period
     * @throws PeriodClosedException if the period refuses this kind of entry
     * @throws AccountNotFoundException if an account does not exist
     * @throws AccountInactiveException if an account is inactive
     * @throws PostingNotAllowedException if an account is a header that takes no postings
     * @throws ImbalanceException if debits and credits differ in a settlement currency
     * @throws DuplicateEntryException if the id has been used for this tenant
     * @throws com.flagship.general_ledger.exception.PolarityViolationException if a balance would take the wrong sign
     * @throws com.flagship.general_ledger.exception.PostingLockTimeoutException if the tenant stays busy too long
     */
    public JournalEntry post(PostJournalEntryCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, command.getTenantId());
        MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, command.getJournalEntryId());

        log.debug("Posting journal entry: kind={}, period={}, lines={}",
            command.getEntryKind(), command.getAccountingPeriod(), command.getLines().size());

        try {
            validateStructure(command);
            JournalEntry posted = lockManager.withTenantLock(command.getTenantId(),
                () -> postLocked(command, null, null));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryPosted(posted.getEntryKind());
            metrics.recordLatency("post", duration);
            log.info("Journal entry posted: period={}, kind={}, lines={}, duration={}ms",
                posted.getAccountingPeriod(), posted.getEntryKind(), posted.getLines().size(), duration);
            return posted;

        } catch (LedgerException e) {
            metrics.recordRejection(e.getErrorCode());
            log.warn("Journal entry rejected: errorCode={}, error={}", e.getErrorCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Reverses a posted entry by posting its mirror image and linking both
     * records in the same store call.
     *
     * @throws ReversalException if the original is missing, already reversed,
     *         itself a reversal, or its period refuses reversals
     */
    public JournalEntry reverse(ReverseJournalEntryCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, command.getTenantId());
        MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, command.getJournalEntryId());

        try {
            JournalEntry reversal = lockManager.withTenantLock(command.getTenantId(), () -> reverseLocked(command));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryPosted(EntryKind.REVERSAL);
            metrics.incrementEntriesReversed();
            metrics.recordLatency("reverse", duration);
            log.info("Journal entry reversed: reversalId={}, reason={}, duration={}ms",
                reversal.getJournalEntryId(), command.getReason(), duration);
            return reversal;

        } catch (LedgerException e) {
            metrics.recordRejection(e.getErrorCode());
            log.warn("Reversal rejected: errorCode={}, error={}", e.getErrorCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY);
        }
    }

    public Optional<JournalEntry> getJournalEntry(String tenantId, String journalEntryId) {
        return ledgerStore.loadJournalEntry(tenantId, journalEntryId);
    }

    /**
     * Entries in posting order, optionally only those of one period.
     */
    public List<JournalEntry> listJournalEntries(String tenantId, String periodId) {
        List<JournalEntry> history = ledgerStore.loadJournalHistory(tenantId, null);
        if (periodId == null) {
            return history;
        }
        return history.stream()
            .filter(entry -> periodId.equals(entry.getAccountingPeriod()))
            .toList();
    }

    // ---- posting pipeline ---------------------------------------------------

    private void validateStructure(PostJournalEntryCommand command) {
        int maxLines = properties.getPosting().getMaxLines();
        if (command.getLines().size() > maxLines) {
            throw new ValidationException(String.format(
                "Journal entry %s has %d lines; at most %d are allowed",
                command.getJournalEntryId(), command.getLines().size(), maxLines));
        }
        AccountingPeriod period = periodGate.requirePeriod(command.getTenantId(), command.getAccountingPeriod());
        if (!period.contains(command.getPostingDate())) {
            throw new ValidationException(String.format(
                "Posting date %s is outside period %s (%s to %s)",
                command.getPostingDate(), period.getPeriodId(), period.getStartDate(), period.getEndDate()));
        }
    }

    /**
     * Runs checks (a) to (f) and writes. Caller holds the tenant lock.
     */
    private JournalEntry postLocked(PostJournalEntryCommand command, String reversalOf, String reversalReason) {
        String tenantId = command.getTenantId();

        // (a) period gate
        periodGate.assertCanPost(tenantId, command.getAccountingPeriod(), command.getEntryKind());

        // (b) accounts exist, are active and accept postings; ascending code order
        Map<String, Account> accounts = loadPostableAccounts(tenantId, command.getLines());

        // (c) settle lines and check balance per settlement currency
        List<JournalEntryLine> settled = new ArrayList<>(command.getLines().size());
        for (JournalEntryLine line : command.getLines()) {
            settled.add(line.settleIn(accounts.get(line.getAccountCode()).getCurrency()));
        }
        assertBalanced(settled);

        // (d) id unused
        if (ledgerStore.journalEntryExists(tenantId, command.getJournalEntryId())) {
            throw new DuplicateEntryException(tenantId, command.getJournalEntryId());
        }

        Instant now = clock.instant();
        JournalEntry entry = JournalEntry.builder()
            .tenantId(tenantId)
            .journalEntryId(command.getJournalEntryId())
            .lines(settled)
            .reference(command.getReference())
            .description(command.getDescription())
            .postingDate(command.getPostingDate())
            .accountingPeriod(command.getAccountingPeriod())
            .entryKind(command.getEntryKind())
            .postedBy(command.getPostedBy())
            .postedAt(now)
            .reversalOf(reversalOf)
            .reversalReason(reversalReason)
            .build();

        // (e) apply deltas; any polarity failure aborts before the write
        PostingBatch.PostingBatchBuilder batch = PostingBatch.builder()
            .tenantId(tenantId)
            .entry(entry);
        for (Map.Entry<String, Money> delta : entry.deltasByAccount().entrySet()) {
            Account previous = accounts.get(delta.getKey());
            batch.previousAccount(previous);
            batch.updatedAccount(previous.applyDelta(delta.getValue(), now));
        }

        // (f) one atomic write
        ledgerStore.applyPosting(batch.build());
        return entry;
    }

    private JournalEntry reverseLocked(ReverseJournalEntryCommand command) {
        String tenantId = command.getTenantId();
        JournalEntry original = ledgerStore.loadJournalEntry(tenantId, command.getJournalEntryId())
            .orElseThrow(() -> new ReversalException(String.format(
                "Journal entry %s not found for tenant %s", command.getJournalEntryId(), tenantId)));

        if (original.isReversed()) {
            throw new ReversalException(String.format(
                "Journal entry %s already reversed by %s", original.getJournalEntryId(), original.getReversedBy()));
        }
        if (original.isReversal()) {
            throw new ReversalException(String.format(
                "Journal entry %s is itself a reversal of %s and cannot be reversed",
                original.getJournalEntryId(), original.getReversalOf()));
        }

        LocalDate reversalDate = command.getReversalDate() != null
            ? command.getReversalDate()
            : original.getPostingDate();
        String periodId = resolveReversalPeriod(command, original, reversalDate);

        List<JournalEntryLine> mirroredLines = original.getLines().stream()
            .map(JournalEntryLine::mirrored)
            .toList();
        PostJournalEntryCommand mirror = PostJournalEntryCommand.builder()
            .tenantId(tenantId)
            .journalEntryId(command.getReversalEntryId())
            .postingDate(reversalDate)
            .accountingPeriod(periodId)
            .entryKind(EntryKind.REVERSAL)
            .reference(original.getReference())
            .description(String.format("Reversal of %s: %s", original.getJournalEntryId(), command.getReason()))
            .postedBy(command.getReversedBy())
            .lines(mirroredLines)
            .build();

        validateStructure(mirror);
        try {
            return postLocked(mirror, original.getJournalEntryId(), command.getReason());
        } catch (PeriodClosedException e) {
            throw new ReversalException(String.format(
                "Period %s does not accept the reversal of %s", periodId, original.getJournalEntryId()), e);
        }
    }

    private String resolveReversalPeriod(ReverseJournalEntryCommand command, JournalEntry original,
                                         LocalDate reversalDate) {
        if (command.getAccountingPeriod() != null) {
            return command.getAccountingPeriod();
        }
        if (command.getReversalDate() == null) {
            return original.getAccountingPeriod();
        }
        return periodGate.findPeriodForDate(command.getTenantId(), reversalDate)
            .map(AccountingPeriod::getPeriodId)
            .orElseThrow(() -> new ValidationException("No accounting period contains " + reversalDate));
    }

    private Map<String, Account> loadPostableAccounts(String tenantId, List<JournalEntryLine> lines) {
        Map<String, Account> accounts = new TreeMap<>();
        TreeSet<String> codes = new TreeSet<>();
        lines.forEach(line -> codes.add(line.getAccountCode()));
        for (String code : codes) {
            Account account = ledgerStore.loadAccount(tenantId, code)
                .orElseThrow(() -> new AccountNotFoundException(tenantId, code));
            if (!account.isActive()) {
                throw new AccountInactiveException("Account " + code + " is inactive");
            }
            if (!account.isPostingAllowed()) {
                throw new PostingNotAllowedException("Account " + code + " does not allow postings");
            }
            accounts.put(code, account);
        }
        return accounts;
    }

    private void assertBalanced(List<JournalEntryLine> lines) {
        Map<CurrencyCode, Money> debits = new EnumMap<>(CurrencyCode.class);
        Map<CurrencyCode, Money> credits = new EnumMap<>(CurrencyCode.class);
        for (JournalEntryLine line : lines) {
            Money amount = line.getSettlementAmount();
            (line.isDebit() ? debits : credits).merge(amount.getCurrency(), amount, Money::add);
        }
        TreeSet<CurrencyCode> currencies = new TreeSet<>(debits.keySet());
        currencies.addAll(credits.keySet());
        for (CurrencyCode currency : currencies) {
            Money debit = debits.getOrDefault(currency, Money.zero(currency));
            Money credit = credits.getOrDefault(currency, Money.zero(currency));
            if (!debit.equals(credit)) {
                throw new ImbalanceException(currency.name(), debit.getAmount(), credit.getAmount());
            }
        }
    }
}
