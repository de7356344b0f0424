package com.flagship.general_ledger.period;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link AccountingPeriodStore} over Spring Data JPA.
 */
@Component
public class JpaAccountingPeriodStore implements AccountingPeriodStore {

    private final AccountingPeriodRepository repository;

    public JpaAccountingPeriodStore(AccountingPeriodRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountingPeriod> findPeriod(String tenantId, String periodId) {
        return repository.findByTenantIdAndPeriodId(tenantId, periodId)
            .map(AccountingPeriodEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccountingPeriod> findPeriods(String tenantId) {
        return repository.findByTenantIdOrderByStartDateAscPeriodIdAsc(tenantId).stream()
            .map(AccountingPeriodEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public AccountingPeriod save(AccountingPeriod period) {
        AccountingPeriodEntity entity = repository
            .findByTenantIdAndPeriodId(period.getTenantId(), period.getPeriodId())
            .orElse(null);
        if (entity == null) {
            entity = AccountingPeriodEntity.fromDomain(period);
        } else {
            entity.updateFromDomain(period);
        }
        return repository.save(entity).toDomain();
    }
}
