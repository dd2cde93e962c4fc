package com.flagship.reconciliation_engine.filing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FilingRepository extends JpaRepository<FilingEntity, UUID> {

    boolean existsByCompanyIdAndFilingTypeAndPeriodYearAndPeriodMonth(
        String companyId, FilingType filingType, int periodYear, int periodMonth);

    List<FilingEntity> findByCompanyIdAndFilingTypeAndFiscalYearOrderByPeriodYearAscPeriodMonthAsc(
        String companyId, FilingType filingType, String fiscalYear);
}
