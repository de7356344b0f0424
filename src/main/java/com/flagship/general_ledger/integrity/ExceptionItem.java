package com.flagship.general_ledger.integrity;

import lombok.Value;

@Value
public class ExceptionItem {
    ExceptionType type;
    Severity severity;
    String message;
    /** Account concerned, or null when the item is not about one account. */
    String accountCode;
    /** Entry concerned, or null. */
    String journalEntryId;
    String recommendation;
}
