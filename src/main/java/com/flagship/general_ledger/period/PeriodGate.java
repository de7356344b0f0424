package com.flagship.general_ledger.period;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.PostingLockManager;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Owns accounting periods and decides which entries each one accepts.
 *
 * Status changes run inside the tenant's posting section, so a transition
 * never interleaves with a posting that has already passed the gate.
 */
@Slf4j
@Service
public class PeriodGate {

    private final AccountingPeriodStore periodStore;
    private final PostingLockManager lockManager;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public PeriodGate(AccountingPeriodStore periodStore, PostingLockManager lockManager,
                      LedgerProperties properties, LedgerMetrics metrics, Clock clock) {
        this.periodStore = periodStore;
        this.lockManager = lockManager;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates an OPEN period.
     *
     * @throws ValidationException if the period already exists
     */
    public AccountingPeriod createPeriod(String tenantId, int fiscalYear, PeriodType periodType, int periodNumber) {
        AccountingPeriod period = AccountingPeriod.open(tenantId, fiscalYear, periodType, periodNumber, clock.instant());
        return lockManager.withTenantLock(period.getTenantId(), () -> {
            if (periodStore.findPeriod(period.getTenantId(), period.getPeriodId()).isPresent()) {
                throw new ValidationException(String.format(
                    "Period %s already exists for tenant %s", period.getPeriodId(), period.getTenantId()));
            }
            AccountingPeriod saved = periodStore.save(period);
            log.info("Accounting period created: tenantId={}, periodId={}, start={}, end={}",
                saved.getTenantId(), saved.getPeriodId(), saved.getStartDate(), saved.getEndDate());
            return saved;
        });
    }

    public Optional<AccountingPeriod> getPeriod(String tenantId, String periodId) {
        return periodStore.findPeriod(tenantId, periodId);
    }

    /**
     * @throws ValidationException if the period does not exist
     */
    public AccountingPeriod requirePeriod(String tenantId, String periodId) {
        return periodStore.findPeriod(tenantId, periodId)
            .orElseThrow(() -> new ValidationException(String.format(
                "Accounting period %s does not exist for tenant %s", periodId, tenantId)));
    }

    public List<AccountingPeriod> listPeriods(String tenantId) {
        return periodStore.findPeriods(tenantId);
    }

    /**
     * The shortest period containing {@code date}: a month before a quarter
     * before a year.
     */
    public Optional<AccountingPeriod> findPeriodForDate(String tenantId, LocalDate date) {
        return periodStore.findPeriods(tenantId).stream()
            .filter(period -> period.contains(date))
            .max(Comparator.comparingInt(period -> period.getPeriodType().getPeriodsPerYear()));
    }

    /**
     * Unknown periods never accept postings.
     */
    public boolean canPost(String tenantId, String periodId, EntryKind kind) {
        return periodStore.findPeriod(tenantId, periodId)
            .map(period -> period.accepts(kind, properties.getPeriod().isAllowAdjustmentsInClosed()))
            .orElse(false);
    }

    /**
     * @throws ValidationException if the period does not exist
     * @throws PeriodClosedException if the period refuses this kind of entry
     */
    public AccountingPeriod assertCanPost(String tenantId, String periodId, EntryKind kind) {
        AccountingPeriod period = requirePeriod(tenantId, periodId);
        if (!period.accepts(kind, properties.getPeriod().isAllowAdjustmentsInClosed())) {
            throw new PeriodClosedException(periodId, String.format(
                "Accounting period %s is %s and does not accept %s entries",
                periodId, period.getStatus(), kind));
        }
        return period;
    }

    /**
     * Moves a period one step forward, or does nothing if it is already in
     * {@code target}.
     *
     * @throws com.flagship.general_ledger.exception.PeriodTransitionException for backward or skipping moves
     */
    public AccountingPeriod transition(String tenantId, String periodId, PeriodStatus target) {
        long startTime = System.currentTimeMillis();
        return lockManager.withTenantLock(tenantId, () -> {
            AccountingPeriod current = requirePeriod(tenantId, periodId);
            AccountingPeriod next = current.transitionTo(target, clock.instant());
            if (next == current) {
                log.debug("Period already in target status: tenantId={}, periodId={}, status={}",
                    tenantId, periodId, target);
                return current;
            }
            AccountingPeriod saved = periodStore.save(next);
            metrics.recordPeriodTransition(target);
            metrics.recordLatency("transition", System.currentTimeMillis() - startTime);
            log.info("Accounting period transitioned: tenantId={}, periodId={}, {} -> {}",
                tenantId, periodId, current.getStatus(), saved.getStatus());
            return saved;
        });
    }

    /**
     * Sets which entry kinds a CLOSED period accepts.
     */
    public AccountingPeriod updatePostingPolicy(String tenantId, String periodId,
                                                boolean allowAdjustments, boolean allowClosingEntries) {
        return lockManager.withTenantLock(tenantId, () -> {
            AccountingPeriod current = requirePeriod(tenantId, periodId);
            AccountingPeriod saved = periodStore.save(
                current.withPostingPolicy(allowAdjustments, allowClosingEntries, clock.instant()));
            log.info("Posting policy updated: tenantId={}, periodId={}, adjustments={}, closingEntries={}",
                tenantId, periodId, allowAdjustments, allowClosingEntries);
            return saved;
        });
    }

    /**
     * Stores the closing checksum and closes the period in one save. Callers
     * must already hold the tenant's posting lock.
     */
    AccountingPeriod closeWithChecksum(AccountingPeriod period, String checksum) {
        Instant now = clock.instant();
        AccountingPeriod closed = period.withClosingChecksum(checksum, now).transitionTo(PeriodStatus.CLOSED, now);
        AccountingPeriod saved = periodStore.save(closed);
        metrics.recordPeriodTransition(PeriodStatus.CLOSED);
        return saved;
    }
}
