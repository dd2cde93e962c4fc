package com.flagship.reconciliation_engine.common;

import lombok.Value;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A July-to-June fiscal year, labelled {@code YYYY-YYYY}.
 */
@Value
public class FiscalYear {

    private static final Pattern LABEL = Pattern.compile("^(\\d{4})-(\\d{4})$");

    int startYear;

    public static FiscalYear of(YearMonth month) {
        int start = month.getMonthValue() >= Month.JULY.getValue() ? month.getYear() : month.getYear() - 1;
        return new FiscalYear(start);
    }

    public static FiscalYear of(LocalDate date) {
        return of(YearMonth.from(date));
    }

    public static FiscalYear parse(String label) {
        Matcher matcher = label == null ? null : LABEL.matcher(label.trim());
        if (matcher == null || !matcher.matches()
            || Integer.parseInt(matcher.group(2)) != Integer.parseInt(matcher.group(1)) + 1) {
            throw new IllegalArgumentException("Fiscal year must look like 2024-2025: " + label);
        }
        return new FiscalYear(Integer.parseInt(matcher.group(1)));
    }

    public String label() {
        return startYear + "-" + (startYear + 1);
    }

    public YearMonth firstMonth() {
        return YearMonth.of(startYear, Month.JULY);
    }

    public YearMonth lastMonth() {
        return YearMonth.of(startYear + 1, Month.JUNE);
    }

    /** July through June, in order. */
    public List<YearMonth> months() {
        List<YearMonth> months = new ArrayList<>(12);
        for (YearMonth m = firstMonth(); !m.isAfter(lastMonth()); m = m.plusMonths(1)) {
            months.add(m);
        }
        return months;
    }

    public boolean contains(YearMonth month) {
        return !month.isBefore(firstMonth()) && !month.isAfter(lastMonth());
    }

    @Override
    public String toString() {
        return label();
    }
}
