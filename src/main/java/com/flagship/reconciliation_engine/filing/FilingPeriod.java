package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.common.FiscalYear;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * The calendar month a filing covers.
 *
 * Monthly statements fall due on the 15th of the following month.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FilingPeriod {

    static final int DUE_DAY_OF_MONTH = 15;

    int year;
    int month;

    public static FilingPeriod of(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12: " + month);
        }
        if (year < 2000 || year > 2100) {
            throw new IllegalArgumentException("Year out of range: " + year);
        }
        return new FilingPeriod(year, month);
    }

    public static FilingPeriod of(YearMonth yearMonth) {
        return of(yearMonth.getYear(), yearMonth.getMonthValue());
    }

    public YearMonth yearMonth() {
        return YearMonth.of(year, month);
    }

    public LocalDate startDate() {
        return yearMonth().atDay(1);
    }

    public LocalDate endDate() {
        return yearMonth().atEndOfMonth();
    }

    public LocalDate dueDate() {
        return yearMonth().plusMonths(1).atDay(DUE_DAY_OF_MONTH);
    }

    public FiscalYear fiscalYear() {
        return FiscalYear.of(yearMonth());
    }

    /**
     * Reference of the ledger posting for this period's deposit.
     */
    public String depositReference() {
        return String.format("WHT-DEP-%s-%02d", fiscalYear().label(), month);
    }

    @Override
    public String toString() {
        return yearMonth().toString();
    }
}
