package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ProfitAndLossStatement {
    String tenantId;
    String periodId;
    LocalDate startDate;
    LocalDate endDate;
    CurrencyCode currency;
    List<StatementLine> revenue;
    List<StatementLine> expenses;
    Money totalRevenue;
    Money totalExpenses;
    Money netIncome;
    /** Accounts left out because they are not held in the reporting currency. */
    List<String> excludedAccounts;
    Instant generatedAt;
}
