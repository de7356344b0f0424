package com.flagship.general_ledger.period;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountingPeriodRepository extends JpaRepository<AccountingPeriodEntity, UUID> {

    Optional<AccountingPeriodEntity> findByTenantIdAndPeriodId(String tenantId, String periodId);

    List<AccountingPeriodEntity> findByTenantIdOrderByStartDateAscPeriodIdAsc(String tenantId);
}
