package com.flagship.reconciliation_engine.recompute;

import com.flagship.reconciliation_engine.aggregation.Aggregator;
import com.flagship.reconciliation_engine.balance.BalanceEngine;
import com.flagship.reconciliation_engine.balance.ReconciliationBalances;
import com.flagship.reconciliation_engine.classification.CategoryClassifier;
import com.flagship.reconciliation_engine.classification.ReconciliationCategory;
import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.SourceOrigin;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.filing.FilingDocument;
import com.flagship.reconciliation_engine.filing.FilingPeriod;
import com.flagship.reconciliation_engine.filing.FilingType;
import com.flagship.reconciliation_engine.reconciliation.AdjustmentEntry;
import com.flagship.reconciliation_engine.reconciliation.ReconciliationDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RecomputationOrchestratorTest {

    private final RecomputationOrchestrator orchestrator =
        new RecomputationOrchestrator(new CategoryClassifier(), new Aggregator(), new BalanceEngine());

    private static SourceRecord record(String amount, String descriptor, String withheld, String counterparty) {
        return SourceRecord.builder()
            .id(UUID.randomUUID())
            .amount(new BigDecimal(amount))
            .timestamp(Instant.parse("2024-03-20T10:00:00Z"))
            .descriptor(descriptor)
            .origin(withheld == null ? SourceOrigin.MANUAL_ADJUSTMENT : SourceOrigin.VENDOR_PAYMENT)
            .counterparty(counterparty)
            .withheldAmount(withheld == null ? null : new BigDecimal(withheld))
            .build();
    }

    private static ReconciliationDocument reconciliation() {
        ReconciliationDocument document = ReconciliationDocument.create("ACME", "1010", YearMonth.of(2024, 3),
            new BigDecimal("4800.00"), new BigDecimal("5000.00"), new BigDecimal("4900.00"), "preparer");
        return document
            .addAdjustments(List.of(
                AdjustmentEntry.unposted(record("100.00", "Deposit in transit", null, null)),
                AdjustmentEntry.unposted(record("250.50", "Cash lodgement", null, null)),
                AdjustmentEntry.unposted(record("10.00", "Deposit slip 88", null, null)),
                AdjustmentEntry.unposted(record("75.25", "Cheque 1045 unpresented", null, null))))
            .withClosingLedgerBalance(new BigDecimal("5285.25"), Instant.now());
    }

    @Test
    @DisplayName("Reconciliation summary is derived from adjustments and balances")
    void recomputesReconciliation() {
        ReconciliationDocument recomputed = orchestrator.recompute(reconciliation());

        assertTrue(recomputed.isRecomputed());
        ReconciliationBalances balances = recomputed.getSummary().getBalances();
        assertEquals(new BigDecimal("360.50"), balances.getDepositsInTransit());
        assertEquals(new BigDecimal("75.25"), balances.getOutstandingChecks());
        assertEquals(new BigDecimal("0.00"), balances.getVariance());
        assertTrue(recomputed.isReconciled());
        assertEquals(4, recomputed.getSummary().getClassifications().size());
    }

    @Test
    @DisplayName("Recomputing twice gives the same summary")
    void idempotent() {
        ReconciliationDocument once = orchestrator.recompute(reconciliation());
        ReconciliationDocument twice = orchestrator.recompute(once);

        assertEquals(once.getSummary(), twice.getSummary());
    }

    @Test
    @DisplayName("Removing an item discards the stale summary and a recompute reflects the removal")
    void editsDropSummary() {
        ReconciliationDocument recomputed = orchestrator.recompute(reconciliation());
        UUID chequeId = recomputed.getAdjustments().get(3).getId();

        ReconciliationDocument edited = recomputed.removeAdjustment(chequeId);
        assertFalse(edited.isRecomputed());

        ReconciliationDocument again = orchestrator.recompute(edited);
        assertEquals(new BigDecimal("0.00"), again.getSummary().getBalances().getOutstandingChecks());
        assertEquals(new BigDecimal("75.25"), again.getSummary().getBalances().getVariance());
        assertFalse(again.isReconciled());
    }

    @Test
    @DisplayName("Posted adjustments keep their category but stop adjusting the ledger")
    void postedAdjustment() {
        ReconciliationDocument document = ReconciliationDocument.create("ACME", "1010", YearMonth.of(2024, 3),
                null, new BigDecimal("975.00"), null, "preparer")
            .addAdjustments(List.of(AdjustmentEntry.unposted(record("25.00", "Bank charges", null, null))))
            .withClosingLedgerBalance(new BigDecimal("1000.00"), Instant.now());
        UUID chargeId = document.getAdjustments().get(0).getId();

        ReconciliationDocument unposted = orchestrator.recompute(document);
        assertTrue(unposted.isReconciled());

        ReconciliationDocument posted = orchestrator.recompute(
            unposted.updateAdjustment(chargeId, e -> e.markPosted("JV-17")));
        assertEquals(ReconciliationCategory.BANK_CHARGES, posted.getSummary().getClassifications().get(chargeId));
        assertEquals(new BigDecimal("0.00"), posted.getSummary().getBalances().getUnpostedBankCharges());
        assertFalse(posted.isReconciled());
    }

    @Test
    @DisplayName("Filing totals match the records section by section")
    void recomputesFiling() {
        FilingDocument filing = FilingDocument.create("ACME", FilingType.WHT_STATEMENT, FilingPeriod.of(2024, 3), "preparer")
            .addRecords(List.of(
                record("100000.00", "Consultancy 153(1)(a)", "8000.00", "Vendor A"),
                record("40000.00", "Stationery supplies", "1800.00", "Vendor B"),
                record("250000.00", "Salary March", "12500.00", null),
                record("5000.00", "Misc", "0.00", "Vendor C")));

        FilingDocument recomputed = orchestrator.recompute(filing);

        assertEquals(4, recomputed.getSummary().getTotals().getTransactionCount());
        assertEquals(new BigDecimal("395000.00"), recomputed.getSummary().getTotals().getGrossAmount());
        assertEquals(new BigDecimal("22300.00"), recomputed.getSummary().getTotals().getWithheldAmount());
        assertEquals(new BigDecimal("8000.00"), recomputed.getSummary().getSections().secondaryOf(WhtSection.SECTION_153_1A));
        assertEquals(new BigDecimal("1800.00"), recomputed.getSummary().getSections().secondaryOf(WhtSection.SECTION_153_1B));
        assertEquals(new BigDecimal("12500.00"), recomputed.getSummary().getSections().secondaryOf(WhtSection.SALARY));
        assertEquals(1, recomputed.getSummary().getSections().bucket(WhtSection.OTHER).getCount());
        assertEquals(new BigDecimal("0.00"), recomputed.getSummary().getTotals().getDepositedAmount());
    }

    @Test
    @DisplayName("Empty filing recomputes to zero totals")
    void emptyFiling() {
        FilingDocument filing = FilingDocument.create("ACME", FilingType.WHT_STATEMENT, FilingPeriod.of(2024, 3), "preparer");

        FilingDocument recomputed = orchestrator.recompute(filing);

        assertEquals(0, recomputed.getSummary().getTotals().getTransactionCount());
        assertEquals(new BigDecimal("0.00"), recomputed.getSummary().getTotals().getWithheldAmount());
    }
}
