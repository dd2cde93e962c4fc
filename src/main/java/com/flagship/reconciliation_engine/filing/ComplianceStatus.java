package com.flagship.reconciliation_engine.filing;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Where a company stands on its monthly statements for the current fiscal year.
 */
@Value
@Builder
public class ComplianceStatus {
    String fiscalYear;
    LocalDate asOf;
    /** Months whose due date has passed. */
    int totalMonthsDue;
    int monthsFiled;
    List<YearMonth> pendingMonths;
    /** Whole percent; 100 when nothing is due yet. */
    int complianceRate;
    List<DueFiling> overdueFilings;
    List<DueFiling> upcomingDueDates;

    @Value
    public static class DueFiling {
        YearMonth period;
        FilingStatus status;
        LocalDate dueDate;
        /** Positive days remaining, or negative days overdue. */
        long daysUntilDue;
    }
}
