package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.classification.WhtSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Month-by-month withholding for one fiscal year, with year totals.
 */
@Value
@Builder
public class WhtFiscalYearSummary {
    String fiscalYear;
    List<MonthlyWhtSummary> months;
    Map<WhtSection, BigDecimal> withheldBySection;
    BigDecimal totalGross;
    BigDecimal totalWithheld;
    BigDecimal totalDeposited;
    /** Filings of the year not yet submitted. */
    int pendingMonths;
}
