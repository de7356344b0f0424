package com.flagship.general_ledger.account;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared relationships between related accounts, e.g. an asset and its
 * accumulated depreciation. Targets are account codes in the same tenant.
 */
@Value
@Builder(toBuilder = true)
public class CompanionLinks {

    public static final CompanionLinks NONE = CompanionLinks.builder().build();

    String accumulatedDepreciationCode;
    String depreciationExpenseCode;
    String allowanceAccountCode;

    /**
     * Every declared link, keyed by the special type the target is expected
     * to carry. Iteration order is stable.
     */
    public Map<SpecialAccountType, String> targets() {
        Map<SpecialAccountType, String> targets = new LinkedHashMap<>();
        if (accumulatedDepreciationCode != null) {
            targets.put(SpecialAccountType.ACCUMULATED_DEPRECIATION, accumulatedDepreciationCode);
        }
        if (depreciationExpenseCode != null) {
            targets.put(SpecialAccountType.DEPRECIATION_EXPENSE, depreciationExpenseCode);
        }
        if (allowanceAccountCode != null) {
            targets.put(SpecialAccountType.ALLOWANCE_FOR_DOUBTFUL_ACCOUNTS, allowanceAccountCode);
        }
        return targets;
    }

    public boolean isEmpty() {
        return accumulatedDepreciationCode == null
            && depreciationExpenseCode == null
            && allowanceAccountCode == null;
    }

    CompanionLinks trimmed() {
        return new CompanionLinks(
            trimToNull(accumulatedDepreciationCode),
            trimToNull(depreciationExpenseCode),
            trimToNull(allowanceAccountCode));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
