package com.flagship.general_ledger.period;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAccountingPeriodStore implements AccountingPeriodStore {

    private final Map<String, Map<String, AccountingPeriod>> periods = new ConcurrentHashMap<>();

    @Override
    public Optional<AccountingPeriod> findPeriod(String tenantId, String periodId) {
        return Optional.ofNullable(periodsOf(tenantId).get(periodId));
    }

    @Override
    public List<AccountingPeriod> findPeriods(String tenantId) {
        return periodsOf(tenantId).values().stream()
            .sorted(Comparator.comparing(AccountingPeriod::getStartDate).thenComparing(AccountingPeriod::getPeriodId))
            .toList();
    }

    @Override
    public AccountingPeriod save(AccountingPeriod period) {
        periodsOf(period.getTenantId()).put(period.getPeriodId(), period);
        return period;
    }

    private Map<String, AccountingPeriod> periodsOf(String tenantId) {
        return periods.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>());
    }
}
