package com.flagship.general_ledger.period;

import com.flagship.general_ledger.exception.IntegrityException;
import com.flagship.general_ledger.exception.PeriodTransitionException;
import com.flagship.general_ledger.integrity.IntegrityReport;
import com.flagship.general_ledger.integrity.IntegrityService;
import com.flagship.general_ledger.journal.PostingLockManager;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.reporting.BalanceSource;
import com.flagship.general_ledger.reporting.TrialBalance;
import com.flagship.general_ledger.reporting.TrialBalanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Closes an OPEN period after proving the ledger is consistent.
 *
 * The integrity check, the trial balance and the status change all run
 * inside the tenant's posting section, so the checksum stored on the period
 * describes exactly the balances the period was closed with.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodCloseService {

    private final PeriodGate periodGate;
    private final IntegrityService integrityService;
    private final TrialBalanceService trialBalanceService;
    private final PostingLockManager lockManager;

    /**
     * @return the CLOSED period carrying the trial balance checksum; an
     *         already CLOSED period is returned unchanged
     * @throws IntegrityException if drift or an unbalanced trial balance exists; the period stays OPEN
     * @throws PeriodTransitionException if the period is LOCKED or FINALIZED
     */
    public AccountingPeriod closePeriod(String tenantId, String periodId) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        try {
            return lockManager.withTenantLock(tenantId, () -> closeLocked(tenantId, periodId));
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }

    private AccountingPeriod closeLocked(String tenantId, String periodId) {
        AccountingPeriod period = periodGate.requirePeriod(tenantId, periodId);
        if (period.getStatus() == PeriodStatus.CLOSED) {
            log.debug("Period already closed: periodId={}", periodId);
            return period;
        }
        if (period.getStatus() != PeriodStatus.OPEN) {
            throw new PeriodTransitionException(String.format(
                "Cannot close period %s in %s status", periodId, period.getStatus()));
        }

        IntegrityReport integrity = integrityService.validateGLIntegrity(tenantId);
        if (!integrity.isHealthy()) {
            log.warn("Period close refused: periodId={}, issues={}", periodId, integrity.describeIssues());
            throw new IntegrityException(String.format(
                "Cannot close period %s: %d integrity issues found", periodId, integrity.issueCount()),
                integrity.issueCount());
        }

        TrialBalance trialBalance = trialBalanceService.computeTrialBalance(
            tenantId, periodId, period.getEndDate(), BalanceSource.REPLAY);
        if (!trialBalance.isBalanced()) {
            log.warn("Period close refused: periodId={}, findings={}", periodId, trialBalance.getFindings());
            throw new IntegrityException(String.format(
                "Cannot close period %s: trial balance as of %s is not balanced",
                periodId, period.getEndDate()), trialBalance.getFindings().size());
        }

        AccountingPeriod closed = periodGate.closeWithChecksum(period, trialBalance.checksum());
        log.info("Accounting period closed: periodId={}, checksum={}", periodId, closed.getClosingChecksum());
        return closed;
    }
}
