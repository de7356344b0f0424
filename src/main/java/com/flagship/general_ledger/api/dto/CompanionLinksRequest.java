package com.flagship.general_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.CompanionLinks;
import lombok.Value;

@Value
public class CompanionLinksRequest {

    @JsonProperty("accumulated_depreciation_code")
    String accumulatedDepreciationCode;

    @JsonProperty("depreciation_expense_code")
    String depreciationExpenseCode;

    @JsonProperty("allowance_account_code")
    String allowanceAccountCode;

    public CompanionLinks toLinks() {
        return CompanionLinks.builder()
            .accumulatedDepreciationCode(accumulatedDepreciationCode)
            .depreciationExpenseCode(depreciationExpenseCode)
            .allowanceAccountCode(allowanceAccountCode)
            .build();
    }
}
