package com.flagship.general_ledger.period;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for accounting periods.
 */
public interface AccountingPeriodStore {

    Optional<AccountingPeriod> findPeriod(String tenantId, String periodId);

    /**
     * All periods of the tenant ordered by start date, then period id.
     */
    List<AccountingPeriod> findPeriods(String tenantId);

    /**
     * Inserts or replaces the period identified by tenant and period id.
     */
    AccountingPeriod save(AccountingPeriod period);
}
