package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodStatus;
import com.flagship.general_ledger.period.PeriodType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class PeriodResponse {

    @JsonProperty("period_id")
    String periodId;

    @JsonProperty("period_name")
    String periodName;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("period_type")
    PeriodType periodType;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("status")
    PeriodStatus status;

    @JsonProperty("allow_adjustments")
    boolean allowAdjustments;

    @JsonProperty("allow_closing_entries")
    boolean allowClosingEntries;

    @JsonProperty("closing_checksum")
    String closingChecksum;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("locked_at")
    Instant lockedAt;

    @JsonProperty("finalized_at")
    Instant finalizedAt;

    public static PeriodResponse from(AccountingPeriod period) {
        return PeriodResponse.builder()
            .periodId(period.getPeriodId())
            .periodName(period.getPeriodName())
            .fiscalYear(period.getFiscalYear())
            .periodType(period.getPeriodType())
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .status(period.getStatus())
            .allowAdjustments(period.isAllowAdjustments())
            .allowClosingEntries(period.isAllowClosingEntries())
            .closingChecksum(period.getClosingChecksum())
            .closedAt(period.getClosedAt())
            .lockedAt(period.getLockedAt())
            .finalizedAt(period.getFinalizedAt())
            .build();
    }
}
