package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Assets = liabilities + equity + current earnings, where current earnings
 * are the revenue and expense balances not yet closed to equity.
 */
@Value
@Builder
public class BalanceSheet {
    String tenantId;
    LocalDate asOfDate;
    BalanceSource source;
    CurrencyCode currency;
    List<StatementLine> assets;
    List<StatementLine> liabilities;
    List<StatementLine> equity;
    Money totalAssets;
    Money totalLiabilities;
    Money totalEquity;
    Money currentEarnings;
    Money totalLiabilitiesAndEquity;
    boolean balanced;
    List<String> excludedAccounts;
    Instant generatedAt;
}
