package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.aggregation.Aggregator;
import com.flagship.reconciliation_engine.balance.BalanceEngine;
import com.flagship.reconciliation_engine.classification.CategoryClassifier;
import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.FiscalYear;
import com.flagship.reconciliation_engine.common.SourceOrigin;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FilingReportServiceTest {

    private static final FiscalYear FY = FiscalYear.parse("2023-2024");

    private final RecomputationOrchestrator orchestrator =
        new RecomputationOrchestrator(new CategoryClassifier(), new Aggregator(), new BalanceEngine());
    private FilingPersistenceService persistenceService;
    private FilingReportService reportService;

    @BeforeEach
    void setUp() {
        persistenceService = mock(FilingPersistenceService.class);
        reportService = new FilingReportService(persistenceService);
    }

    private FilingDocument filing(int year, int month, FilingStatus status, SourceRecord... records) {
        return orchestrator.recompute(
            FilingDocument.create("ACME", FilingType.WHT_STATEMENT, FilingPeriod.of(year, month), "preparer")
                .addRecords(List.of(records))
                .toBuilder().status(status).build());
    }

    private static SourceRecord payment(String payee, String gross, String withheld, String descriptor) {
        return SourceRecord.builder()
            .id(UUID.randomUUID())
            .amount(new BigDecimal(gross))
            .withheldAmount(new BigDecimal(withheld))
            .timestamp(Instant.parse("2023-08-10T00:00:00Z"))
            .descriptor(descriptor)
            .origin(SourceOrigin.VENDOR_PAYMENT)
            .counterparty(payee)
            .build();
    }

    private void given(FilingDocument... filings) {
        when(persistenceService.findByFiscalYear("ACME", FilingType.WHT_STATEMENT, FY)).thenReturn(List.of(filings));
    }

    @Test
    @DisplayName("Year summary adds up months and counts unsubmitted ones")
    void fiscalYearSummary() {
        given(
            filing(2023, 7, FilingStatus.ACKNOWLEDGED,
                payment("Vendor A", "100000.00", "8000.00", "153(1)(a) consultancy")),
            filing(2023, 8, FilingStatus.PREPARED,
                payment("Vendor B", "40000.00", "1800.00", "Supplies"),
                payment("Vendor A", "50000.00", "4000.00", "153(1)(a) audit")));

        WhtFiscalYearSummary summary = reportService.fiscalYearSummary("ACME", FY);

        assertEquals("2023-2024", summary.getFiscalYear());
        assertEquals(2, summary.getMonths().size());
        assertEquals(YearMonth.of(2023, 7), summary.getMonths().get(0).getPeriod());
        assertTrue(summary.getMonths().get(0).isFiled());
        assertFalse(summary.getMonths().get(1).isFiled());
        assertEquals(new BigDecimal("12000.00"), summary.getWithheldBySection().get(WhtSection.SECTION_153_1A));
        assertEquals(new BigDecimal("1800.00"), summary.getWithheldBySection().get(WhtSection.SECTION_153_1B));
        assertEquals(new BigDecimal("0.00"), summary.getWithheldBySection().get(WhtSection.SALARY));
        assertEquals(new BigDecimal("190000.00"), summary.getTotalGross());
        assertEquals(new BigDecimal("13800.00"), summary.getTotalWithheld());
        assertEquals(1, summary.getPendingMonths());
    }

    @Test
    @DisplayName("Payees are grouped case-insensitively and ranked by tax withheld")
    void payeeTotals() {
        given(
            filing(2023, 7, FilingStatus.SUBMITTED,
                payment("Vendor A", "100000.00", "8000.00", "153(1)(a)"),
                payment("Vendor B", "40000.00", "1800.00", "Supplies"),
                payment(" ", "500.00", "0.00", "Walk-in")),
            filing(2023, 8, FilingStatus.DRAFT,
                payment("vendor a", "50000.00", "4000.00", "153(1)(a)"),
                payment("Vendor C", "900000.00", "45000.00", "153(1)(c) construction")));

        List<PayeeWhtTotal> payees = reportService.payeeTotals("ACME", FY);

        assertEquals(3, payees.size());
        assertEquals("Vendor C", payees.get(0).getCounterparty());
        assertEquals("Vendor A", payees.get(1).getCounterparty());
        assertEquals(2, payees.get(1).getTransactionCount());
        assertEquals(new BigDecimal("12000.00"), payees.get(1).getTotalWithheld());
        assertEquals(new BigDecimal("150000.00"), payees.get(1).getTotalGross());
        assertEquals(WhtSection.SECTION_153_1A, payees.get(1).getDeductions().get(0).getSection());
        assertEquals("Vendor B", payees.get(2).getCounterparty());
    }

    @Test
    @DisplayName("Compliance counts months whose due date has passed")
    void complianceStatus() {
        given(
            filing(2023, 7, FilingStatus.ACKNOWLEDGED),
            filing(2023, 8, FilingStatus.SUBMITTED),
            filing(2023, 9, FilingStatus.REVIEWED),
            filing(2023, 10, FilingStatus.DRAFT));

        // July, August and September are due by 20 October; October is due 15 November.
        ComplianceStatus status = reportService.complianceStatus("ACME", LocalDate.of(2023, 10, 20));

        assertEquals("2023-2024", status.getFiscalYear());
        assertEquals(3, status.getTotalMonthsDue());
        assertEquals(2, status.getMonthsFiled());
        assertEquals(List.of(YearMonth.of(2023, 9)), status.getPendingMonths());
        assertEquals(67, status.getComplianceRate());

        assertEquals(1, status.getOverdueFilings().size());
        assertEquals(YearMonth.of(2023, 9), status.getOverdueFilings().get(0).getPeriod());
        assertEquals(-5, status.getOverdueFilings().get(0).getDaysUntilDue());

        assertEquals(1, status.getUpcomingDueDates().size());
        assertEquals(LocalDate.of(2023, 11, 15), status.getUpcomingDueDates().get(0).getDueDate());
        assertEquals(26, status.getUpcomingDueDates().get(0).getDaysUntilDue());
    }

    @Test
    @DisplayName("Missing statements count as pending")
    void missingMonthsArePending() {
        given(filing(2023, 7, FilingStatus.SUBMITTED));

        ComplianceStatus status = reportService.complianceStatus("ACME", LocalDate.of(2023, 9, 16));

        assertEquals(2, status.getTotalMonthsDue());
        assertEquals(List.of(YearMonth.of(2023, 8)), status.getPendingMonths());
        assertEquals(50, status.getComplianceRate());
        assertTrue(status.getOverdueFilings().isEmpty());
    }

    @Test
    @DisplayName("Nothing due yet means full compliance")
    void nothingDue() {
        given();

        ComplianceStatus status = reportService.complianceStatus("ACME", LocalDate.of(2023, 7, 31));

        assertEquals(0, status.getTotalMonthsDue());
        assertEquals(100, status.getComplianceRate());
    }

    @Test
    @DisplayName("On its due date a month is upcoming, the day after it is overdue")
    void dueDateBoundary() {
        given(
            filing(2023, 7, FilingStatus.SUBMITTED),
            filing(2023, 8, FilingStatus.REVIEWED));

        ComplianceStatus onDueDate = reportService.complianceStatus("ACME", LocalDate.of(2023, 9, 15));

        assertEquals(1, onDueDate.getTotalMonthsDue());
        assertTrue(onDueDate.getPendingMonths().isEmpty());
        assertTrue(onDueDate.getOverdueFilings().isEmpty());
        assertEquals(1, onDueDate.getUpcomingDueDates().size());
        assertEquals(0, onDueDate.getUpcomingDueDates().get(0).getDaysUntilDue());

        ComplianceStatus dayAfter = reportService.complianceStatus("ACME", LocalDate.of(2023, 9, 16));

        assertEquals(2, dayAfter.getTotalMonthsDue());
        assertEquals(List.of(YearMonth.of(2023, 8)), dayAfter.getPendingMonths());
        assertEquals(1, dayAfter.getOverdueFilings().size());
        assertEquals(-1, dayAfter.getOverdueFilings().get(0).getDaysUntilDue());
        assertTrue(dayAfter.getUpcomingDueDates().isEmpty());
    }
}
