package com.flagship.general_ledger.period;

import com.flagship.general_ledger.exception.PeriodTransitionException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.EntryKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Accounting period with an explicit state machine.
 *
 * Key principles:
 * - Status moves forward one step at a time; moving to the current status is a no-op
 * - Transitions are immutable (a new AccountingPeriod is returned)
 * - Which entries a period accepts is decided by {@link #accepts(EntryKind, boolean)}
 */
@Value
@Builder(toBuilder = true)
public class AccountingPeriod {
    String tenantId;
    String periodId;
    String periodName;
    int fiscalYear;
    PeriodType periodType;
    LocalDate startDate;
    LocalDate endDate;
    PeriodStatus status;
    boolean allowAdjustments;
    boolean allowClosingEntries;
    String closingChecksum;
    Instant createdAt;
    Instant updatedAt;
    Instant closedAt;
    Instant lockedAt;
    Instant finalizedAt;

    /**
     * Creates a new OPEN period covering calendar dates of the fiscal year.
     * Adjustments are allowed and closing entries are not until the policy
     * is changed.
     */
    public static AccountingPeriod open(String tenantId, int fiscalYear, PeriodType periodType,
                                        int periodNumber, Instant now) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (periodType == null) {
            throw new ValidationException("Period type is required");
        }
        if (fiscalYear < 1900 || fiscalYear > 9999) {
            throw new ValidationException("Fiscal year out of range: " + fiscalYear);
        }
        if (periodNumber < 1 || periodNumber > periodType.getPeriodsPerYear()) {
            throw new ValidationException(String.format(
                "%s period number must be between 1 and %d, got %d",
                periodType, periodType.getPeriodsPerYear(), periodNumber));
        }
        return AccountingPeriod.builder()
            .tenantId(tenantId.trim())
            .periodId(periodType.periodId(fiscalYear, periodNumber))
            .periodName(periodType.periodName(fiscalYear, periodNumber))
            .fiscalYear(fiscalYear)
            .periodType(periodType)
            .startDate(periodType.startDate(fiscalYear, periodNumber))
            .endDate(periodType.endDate(fiscalYear, periodNumber))
            .status(PeriodStatus.OPEN)
            .allowAdjustments(true)
            .allowClosingEntries(false)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    /**
     * Whether an entry of the given kind may be posted in this period.
     *
     * @param closedExceptionsEnabled global switch for the CLOSED-period exceptions
     */
    public boolean accepts(EntryKind kind, boolean closedExceptionsEnabled) {
        return switch (status) {
            case OPEN -> true;
            case CLOSED -> closedExceptionsEnabled && acceptsInClosed(kind);
            case LOCKED, FINALIZED -> false;
        };
    }

    private boolean acceptsInClosed(EntryKind kind) {
        return switch (kind) {
            case ADJUSTING, REVERSAL -> allowAdjustments;
            case CLOSING -> allowClosingEntries;
            default -> false;
        };
    }

    public boolean canTransitionTo(PeriodStatus target) {
        return target == status || target == status.next();
    }

    /**
     * Moves the period to {@code target}.
     *
     * @return this instance when already in {@code target}, otherwise a new instance
     * @throws PeriodTransitionException if the move goes backwards or skips a step
     */
    public AccountingPeriod transitionTo(PeriodStatus target, Instant at) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        if (target == status) {
            return this;
        }
        if (target != status.next()) {
            throw new PeriodTransitionException(String.format(
                "Cannot move period %s from %s to %s. Next allowed status is %s.",
                periodId, status, target, status.next() != null ? status.next() : "none"));
        }
        AccountingPeriodBuilder next = toBuilder().status(target).updatedAt(at);
        switch (target) {
            case CLOSED -> next.closedAt(at);
            case LOCKED -> next.lockedAt(at);
            case FINALIZED -> next.finalizedAt(at);
            default -> { }
        }
        return next.build();
    }

    public AccountingPeriod withClosingChecksum(String checksum, Instant at) {
        return toBuilder().closingChecksum(checksum).updatedAt(at).build();
    }

    /**
     * Changes which entry kinds a CLOSED period accepts. Only allowed while
     * the period is OPEN or CLOSED.
     */
    public AccountingPeriod withPostingPolicy(boolean adjustments, boolean closingEntries, Instant at) {
        if (status == PeriodStatus.LOCKED || status == PeriodStatus.FINALIZED) {
            throw new PeriodTransitionException(String.format(
                "Posting policy of %s period %s can no longer change", status, periodId));
        }
        return toBuilder().allowAdjustments(adjustments).allowClosingEntries(closingEntries).updatedAt(at).build();
    }
}
