package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.period.PeriodStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PeriodTransitionRequest {

    @NotNull(message = "Target status is required")
    @JsonProperty("status")
    PeriodStatus status;
}
