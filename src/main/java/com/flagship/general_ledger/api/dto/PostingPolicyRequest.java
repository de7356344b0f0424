package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Which entry kinds a CLOSED period keeps accepting.
 */
@Value
public class PostingPolicyRequest {

    @NotNull(message = "allow_adjustments is required")
    @JsonProperty("allow_adjustments")
    Boolean allowAdjustments;

    @NotNull(message = "allow_closing_entries is required")
    @JsonProperty("allow_closing_entries")
    Boolean allowClosingEntries;
}
