package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.Money;
import lombok.Value;

/**
 * One account on a financial statement, in presentation sign: revenue,
 * liabilities and equity are shown positive when they have their normal
 * credit balance.
 */
@Value
public class StatementLine {
    String accountCode;
    String accountName;
    Money amount;
}
