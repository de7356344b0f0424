package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.Money;
import lombok.Value;

import java.time.LocalDate;

/**
 * Net cash movement of one journal entry. Positive amounts are inflows.
 */
@Value
public class CashFlowItem {
    String journalEntryId;
    LocalDate postingDate;
    String description;
    CashFlowCategory category;
    String counterAccountCode;
    Money amount;
}
