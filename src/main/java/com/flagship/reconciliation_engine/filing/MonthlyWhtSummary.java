package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.classification.WhtSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MonthlyWhtSummary {
    UUID filingId;
    YearMonth period;
    FilingStatus status;
    Map<WhtSection, BigDecimal> withheldBySection;
    BigDecimal totalGross;
    BigDecimal totalWithheld;
    BigDecimal totalDeposited;
    boolean filed;
}
