package com.flagship.general_ledger.integrity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ExceptionReport {
    String tenantId;
    String periodId;
    Instant generatedAt;
    @Singular
    List<ExceptionItem> exceptions;

    public int getTotalExceptions() {
        return exceptions.size();
    }

    /**
     * True when any item is HIGH or CRITICAL.
     */
    @JsonProperty("requiresAttention")
    public boolean requiresAttention() {
        return exceptions.stream().anyMatch(item -> item.getSeverity().requiresAttention());
    }
}
