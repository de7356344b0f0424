package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Direct-method cash flow statement over the CASH accounts.
 * {@code reconciled} holds when beginning cash plus net change equals ending cash.
 */
@Value
@Builder
public class CashFlowStatement {
    String tenantId;
    String periodId;
    LocalDate startDate;
    LocalDate endDate;
    CurrencyCode currency;
    List<String> cashAccounts;
    List<CashFlowItem> operatingActivities;
    List<CashFlowItem> investingActivities;
    List<CashFlowItem> financingActivities;
    Money netCashFromOperating;
    Money netCashFromInvesting;
    Money netCashFromFinancing;
    Money netChangeInCash;
    Money beginningCash;
    Money endingCash;
    boolean reconciled;
    Instant generatedAt;
}
