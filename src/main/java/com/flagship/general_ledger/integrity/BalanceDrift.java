package com.flagship.general_ledger.integrity;

import com.flagship.general_ledger.money.Money;
import lombok.Value;

/**
 * Stored balance of an account disagrees with the balance its journal
 * history produces.
 */
@Value
public class BalanceDrift {
    String accountCode;
    /** Balance rebuilt from the journal. */
    Money expected;
    /** Balance stored on the account. */
    Money actual;
    /** actual - expected */
    Money difference;
    /** First entry whose delta on the account matches the drift, or null. */
    String firstOffendingEntryId;
}
