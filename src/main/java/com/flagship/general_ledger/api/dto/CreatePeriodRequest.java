package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.period.PeriodType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class CreatePeriodRequest {

    @NotNull(message = "Fiscal year is required")
    @Min(value = 1900, message = "Fiscal year must be 1900 or later")
    @Max(value = 9999, message = "Fiscal year must be 9999 or earlier")
    @JsonProperty("fiscal_year")
    Integer fiscalYear;

    @NotNull(message = "Period type is required")
    @JsonProperty("period_type")
    PeriodType periodType;

    @NotNull(message = "Period number is required")
    @Min(value = 1, message = "Period number must be at least 1")
    @JsonProperty("period_number")
    Integer periodNumber;
}
