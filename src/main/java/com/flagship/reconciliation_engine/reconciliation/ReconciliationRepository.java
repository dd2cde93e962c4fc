package com.flagship.reconciliation_engine.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReconciliationRepository extends JpaRepository<ReconciliationEntity, UUID> {

    boolean existsByCompanyIdAndAccountRefAndPeriod(String companyId, String accountRef, String period);

    List<ReconciliationEntity> findByCompanyIdAndAccountRefOrderByPeriodDesc(String companyId, String accountRef);
}
