package com.flagship.general_ledger.integrity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ReconciliationReport {
    String tenantId;
    String periodId;
    LocalDate asOfDate;
    Instant generatedAt;
    @Singular
    List<Variance> variances;
    @Singular
    List<String> recommendations;

    public int getTotalVariances() {
        return variances.size();
    }

    public boolean isReconciled() {
        return variances.isEmpty();
    }
}
