package com.flagship.general_ledger.period;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for accounting period persistence.
 *
 * Key design principles:
 * - No @Setter: the state machine lives in {@link AccountingPeriod}
 * - Identity fields (tenant, period id, dates) are updatable = false
 * - fromDomain() is the only way to create entities; updateFromDomain() copies
 *   the fields a transition may change
 */
@Entity
@Table(
    name = "accounting_periods",
    uniqueConstraints = @UniqueConstraint(name = "uq_accounting_periods_tenant_period",
        columnNames = {"tenant_id", "period_id"}),
    indexes = @Index(name = "idx_accounting_periods_tenant", columnList = "tenant_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountingPeriodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "period_id", nullable = false, updatable = false)
    private String periodId;

    @Column(name = "period_name", nullable = false, updatable = false)
    private String periodName;

    @Column(name = "fiscal_year", nullable = false, updatable = false)
    private int fiscalYear;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, updatable = false)
    private PeriodType periodType;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PeriodStatus status;

    @Column(name = "allow_adjustments", nullable = false)
    private boolean allowAdjustments;

    @Column(name = "allow_closing_entries", nullable = false)
    private boolean allowClosingEntries;

    @Column(name = "closing_checksum", length = 64)
    private String closingChecksum;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "finalized_at")
    private Instant finalizedAt;

    static AccountingPeriodEntity fromDomain(AccountingPeriod period) {
        return new AccountingPeriodEntity(
            UUID.randomUUID(),
            period.getTenantId(),
            period.getPeriodId(),
            period.getPeriodName(),
            period.getFiscalYear(),
            period.getPeriodType(),
            period.getStartDate(),
            period.getEndDate(),
            period.getStatus(),
            period.isAllowAdjustments(),
            period.isAllowClosingEntries(),
            period.getClosingChecksum(),
            period.getCreatedAt(),
            period.getUpdatedAt(),
            period.getClosedAt(),
            period.getLockedAt(),
            period.getFinalizedAt()
        );
    }

    public AccountingPeriod toDomain() {
        return AccountingPeriod.builder()
            .tenantId(tenantId)
            .periodId(periodId)
            .periodName(periodName)
            .fiscalYear(fiscalYear)
            .periodType(periodType)
            .startDate(startDate)
            .endDate(endDate)
            .status(status)
            .allowAdjustments(allowAdjustments)
            .allowClosingEntries(allowClosingEntries)
            .closingChecksum(closingChecksum)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .closedAt(closedAt)
            .lockedAt(lockedAt)
            .finalizedAt(finalizedAt)
            .build();
    }

    /**
     * Copies the mutable fields. Identity and calendar fields never change.
     */
    void updateFromDomain(AccountingPeriod period) {
        this.status = period.getStatus();
        this.allowAdjustments = period.isAllowAdjustments();
        this.allowClosingEntries = period.isAllowClosingEntries();
        this.closingChecksum = period.getClosingChecksum();
        this.updatedAt = period.getUpdatedAt();
        this.closedAt = period.getClosedAt();
        this.lockedAt = period.getLockedAt();
        this.finalizedAt = period.getFinalizedAt();
    }
}
