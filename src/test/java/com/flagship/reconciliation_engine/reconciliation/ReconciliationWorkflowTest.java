package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.aggregation.Aggregator;
import com.flagship.reconciliation_engine.balance.BalanceEngine;
import com.flagship.reconciliation_engine.classification.CategoryClassifier;
import com.flagship.reconciliation_engine.exception.InvalidTransitionException;
import com.flagship.reconciliation_engine.exception.ValidationException;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import com.flagship.reconciliation_engine.workflow.SideEffect;
import com.flagship.reconciliation_engine.workflow.TransitionDecision;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationWorkflowTest {

    private final ReconciliationWorkflow workflow = new ReconciliationWorkflow();
    private final RecomputationOrchestrator orchestrator =
        new RecomputationOrchestrator(new CategoryClassifier(), new Aggregator(), new BalanceEngine());

    private ReconciliationDocument document(ReconciliationStatus status, BigDecimal closingLedger) {
        ReconciliationDocument document = ReconciliationDocument.create("ACME", "1010", YearMonth.of(2024, 3),
            null, new BigDecimal("1000.00"), null, "preparer");
        if (closingLedger != null) {
            document = document.withClosingLedgerBalance(closingLedger, Instant.now());
        }
        return orchestrator.recompute(document).toBuilder().status(status).build();
    }

    private static TransitionRequest<ReconciliationStatus> request(ReconciliationStatus to, String actor) {
        return TransitionRequest.<ReconciliationStatus>builder()
            .requestedStatus(to)
            .actorId(actor)
            .build();
    }

    @Test
    @DisplayName("Draft can be prepared")
    void draftToInProgress() {
        TransitionDecision<ReconciliationStatus> decision = workflow.decide(
            document(ReconciliationStatus.DRAFT, null), request(ReconciliationStatus.IN_PROGRESS, "preparer"));

        assertTrue(decision.isAllowed());
        assertEquals(SideEffect.NONE, decision.getSideEffect());
    }

    @Test
    @DisplayName("Draft cannot jump to approved")
    void draftToApprovedRejected() {
        TransitionDecision<ReconciliationStatus> decision = workflow.decide(
            document(ReconciliationStatus.DRAFT, new BigDecimal("1000.00")),
            request(ReconciliationStatus.APPROVED, "approver"));

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("IN_PROGRESS"));
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class, decision::orThrow);
        assertEquals("DRAFT", e.getFromStatus());
        assertEquals("APPROVED", e.getToStatus());
    }

    @Test
    @DisplayName("Completing needs a fetched ledger balance")
    void completeWithoutLedgerBalance() {
        TransitionDecision<ReconciliationStatus> decision = workflow.decide(
            document(ReconciliationStatus.IN_PROGRESS, null), request(ReconciliationStatus.COMPLETED, "preparer"));

        assertFalse(decision.isAllowed());
        assertEquals("Closing ledger balance has not been fetched", decision.getReason());
    }

    @Test
    @DisplayName("Completing needs a variance inside tolerance")
    void completeWithVariance() {
        TransitionDecision<ReconciliationStatus> decision = workflow.decide(
            document(ReconciliationStatus.IN_PROGRESS, new BigDecimal("990.00")),
            request(ReconciliationStatus.COMPLETED, "preparer"));

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("10.00"));
    }

    @Test
    @DisplayName("Reconciled document can be completed and approved")
    void completeAndApprove() {
        assertTrue(workflow.decide(document(ReconciliationStatus.IN_PROGRESS, new BigDecimal("1000.00")),
            request(ReconciliationStatus.COMPLETED, "preparer")).isAllowed());
        assertTrue(workflow.decide(document(ReconciliationStatus.COMPLETED, new BigDecimal("1000.00")),
            request(ReconciliationStatus.APPROVED, "approver")).isAllowed());
    }

    @Test
    @DisplayName("Approved is terminal and no transition goes backwards")
    void noBackwardTransitions() {
        assertFalse(workflow.decide(document(ReconciliationStatus.APPROVED, new BigDecimal("1000.00")),
            request(ReconciliationStatus.COMPLETED, "approver")).isAllowed());
        assertFalse(workflow.decide(document(ReconciliationStatus.COMPLETED, new BigDecimal("1000.00")),
            request(ReconciliationStatus.IN_PROGRESS, "preparer")).isAllowed());
        assertTrue(ReconciliationWorkflow.STATE_MACHINE.isTerminal(ReconciliationStatus.APPROVED));
    }

    @Test
    @DisplayName("Requesting the current status is rejected")
    void sameStatusRejected() {
        TransitionDecision<ReconciliationStatus> decision = workflow.decide(
            document(ReconciliationStatus.IN_PROGRESS, null), request(ReconciliationStatus.IN_PROGRESS, "preparer"));

        assertFalse(decision.isAllowed());
    }

    @Test
    @DisplayName("Transition without an actor is invalid")
    void actorRequired() {
        assertThrows(ValidationException.class, () -> workflow.decide(
            document(ReconciliationStatus.DRAFT, null), request(ReconciliationStatus.IN_PROGRESS, " ")));
    }

    @Test
    @DisplayName("Only draft and in-progress documents are editable")
    void editability() {
        assertTrue(workflow.isEditable(ReconciliationStatus.DRAFT));
        assertTrue(workflow.isEditable(ReconciliationStatus.IN_PROGRESS));
        assertFalse(workflow.isEditable(ReconciliationStatus.COMPLETED));
        assertFalse(workflow.isEditable(ReconciliationStatus.APPROVED));
    }
}
