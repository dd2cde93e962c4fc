package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.common.FiscalYear;
import com.flagship.reconciliation_engine.common.SourceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only reports over a company's WHT statements.
 *
 * Figures come from recomputed documents, so they always agree with the
 * per-filing summaries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilingReportService {

    /** Statuses that count as filed with the authority. */
    static final Set<FilingStatus> FILED = EnumSet.of(
        FilingStatus.SUBMITTED, FilingStatus.ACKNOWLEDGED, FilingStatus.AMENDED);

    private final FilingPersistenceService persistenceService;

    public WhtFiscalYearSummary fiscalYearSummary(String companyId, FiscalYear fiscalYear) {
        List<FilingDocument> filings = statements(companyId, fiscalYear);

        List<MonthlyWhtSummary> months = new ArrayList<>(filings.size());
        Map<WhtSection, BigDecimal> yearBySection = zeroBySection();
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal withheld = BigDecimal.ZERO;
        BigDecimal deposited = BigDecimal.ZERO;

        for (FilingDocument filing : filings) {
            FilingSummary summary = filing.getSummary();
            Map<WhtSection, BigDecimal> bySection = zeroBySection();
            summary.getSections().getBuckets().forEach((section, bucket) -> {
                bySection.put(section, bucket.getSecondarySum());
                yearBySection.merge(section, bucket.getSecondarySum(), BigDecimal::add);
            });

            months.add(MonthlyWhtSummary.builder()
                .filingId(filing.getId())
                .period(filing.getPeriod().yearMonth())
                .status(filing.getStatus())
                .withheldBySection(bySection)
                .totalGross(summary.getTotals().getGrossAmount())
                .totalWithheld(summary.getTotals().getWithheldAmount())
                .totalDeposited(summary.getTotals().getDepositedAmount())
                .filed(FILED.contains(filing.getStatus()))
                .build());

            gross = gross.add(summary.getTotals().getGrossAmount());
            withheld = withheld.add(summary.getTotals().getWithheldAmount());
            deposited = deposited.add(summary.getTotals().getDepositedAmount());
        }

        return WhtFiscalYearSummary.builder()
            .fiscalYear(fiscalYear.label())
            .months(List.copyOf(months))
            .withheldBySection(yearBySection)
            .totalGross(Amounts.round2(gross))
            .totalWithheld(Amounts.round2(withheld))
            .totalDeposited(Amounts.round2(deposited))
            .pendingMonths((int) months.stream().filter(m -> !m.isFiled()).count())
            .build();
    }

    /**
     * Withholding per payee, largest first. Records without a counterparty are
     * left out; payees are matched case-insensitively.
     */
    public List<PayeeWhtTotal> payeeTotals(String companyId, FiscalYear fiscalYear) {
        Map<String, List<PayeeWhtTotal.Deduction>> byPayee = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();

        for (FilingDocument filing : statements(companyId, fiscalYear)) {
            for (SourceRecord record : filing.getRecords()) {
                if (record.getCounterparty() == null || record.getCounterparty().isBlank()) {
                    continue;
                }
                String key = record.getCounterparty().trim().toLowerCase(Locale.ROOT);
                displayNames.putIfAbsent(key, record.getCounterparty().trim());
                byPayee.computeIfAbsent(key, k -> new ArrayList<>()).add(new PayeeWhtTotal.Deduction(
                    record.getTimestamp(),
                    record.getAmount(),
                    Amounts.orZero(record.getWithheldAmount()),
                    filing.getSummary().getClassifications().get(record.getId())));
            }
        }

        List<PayeeWhtTotal> totals = new ArrayList<>(byPayee.size());
        byPayee.forEach((key, deductions) -> {
            BigDecimal gross = BigDecimal.ZERO;
            BigDecimal withheld = BigDecimal.ZERO;
            for (PayeeWhtTotal.Deduction deduction : deductions) {
                gross = gross.add(deduction.getGrossAmount());
                withheld = withheld.add(deduction.getWithheldAmount());
            }
            totals.add(PayeeWhtTotal.builder()
                .counterparty(displayNames.get(key))
                .transactionCount(deductions.size())
                .totalGross(Amounts.round2(gross))
                .totalWithheld(Amounts.round2(withheld))
                .deductions(List.copyOf(deductions))
                .build());
        });
        totals.sort(Comparator.comparing(PayeeWhtTotal::getTotalWithheld).reversed()
            .thenComparing(PayeeWhtTotal::getCounterparty));
        return totals;
    }

    /**
     * Filing compliance for the fiscal year containing {@code today}.
     *
     * A month is due once its due date has passed; it is filed once its
     * statement has been submitted. An unfiled month that is due is overdue,
     * and on the due date itself it is still upcoming with zero days left.
     */
    public ComplianceStatus complianceStatus(String companyId, LocalDate today) {
        FiscalYear fiscalYear = FiscalYear.of(today);
        List<FilingDocument> filings = statements(companyId, fiscalYear);

        Map<YearMonth, FilingDocument> byMonth = new LinkedHashMap<>();
        filings.forEach(f -> byMonth.put(f.getPeriod().yearMonth(), f));

        List<YearMonth> due = new ArrayList<>();
        for (YearMonth month : fiscalYear.months()) {
            if (isPastDue(FilingPeriod.of(month).dueDate(), today)) {
                due.add(month);
            }
        }

        List<YearMonth> pending = due.stream()
            .filter(m -> !byMonth.containsKey(m) || !FILED.contains(byMonth.get(m).getStatus()))
            .toList();
        int filed = due.size() - pending.size();
        int rate = due.isEmpty()
            ? 100
            : BigDecimal.valueOf(filed * 100L).divide(BigDecimal.valueOf(due.size()), 0, RoundingMode.HALF_UP).intValue();

        List<ComplianceStatus.DueFiling> overdue = new ArrayList<>();
        List<ComplianceStatus.DueFiling> upcoming = new ArrayList<>();
        for (FilingDocument filing : filings) {
            if (FILED.contains(filing.getStatus())) {
                continue;
            }
            LocalDate dueDate = filing.getPeriod().dueDate();
            ComplianceStatus.DueFiling entry = new ComplianceStatus.DueFiling(
                filing.getPeriod().yearMonth(), filing.getStatus(), dueDate, ChronoUnit.DAYS.between(today, dueDate));
            if (isPastDue(dueDate, today)) {
                overdue.add(entry);
            } else {
                upcoming.add(entry);
            }
        }
        overdue.sort(Comparator.comparing(ComplianceStatus.DueFiling::getDueDate));
        upcoming.sort(Comparator.comparing(ComplianceStatus.DueFiling::getDaysUntilDue));

        log.debug("Compliance for {} {}: due={}, filed={}, overdue={}",
            companyId, fiscalYear, due.size(), filed, overdue.size());

        return ComplianceStatus.builder()
            .fiscalYear(fiscalYear.label())
            .asOf(today)
            .totalMonthsDue(due.size())
            .monthsFiled(filed)
            .pendingMonths(pending)
            .complianceRate(rate)
            .overdueFilings(List.copyOf(overdue))
            .upcomingDueDates(List.copyOf(upcoming))
            .build();
    }

    private static boolean isPastDue(LocalDate dueDate, LocalDate today) {
        return dueDate.isBefore(today);
    }

    private List<FilingDocument> statements(String companyId, FiscalYear fiscalYear) {
        return persistenceService.findByFiscalYear(companyId, FilingType.WHT_STATEMENT, fiscalYear);
    }

    private static Map<WhtSection, BigDecimal> zeroBySection() {
        Map<WhtSection, BigDecimal> map = new EnumMap<>(WhtSection.class);
        for (WhtSection section : WhtSection.values()) {
            map.put(section, Amounts.exposedZero());
        }
        return map;
    }
}
