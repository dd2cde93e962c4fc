package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.aggregation.Aggregator;
import com.flagship.reconciliation_engine.balance.BalanceEngine;
import com.flagship.reconciliation_engine.classification.CategoryClassifier;
import com.flagship.reconciliation_engine.common.RawSourceRecord;
import com.flagship.reconciliation_engine.common.SourceOrigin;
import com.flagship.reconciliation_engine.common.SourceRecordValidator;
import com.flagship.reconciliation_engine.event.DocumentCreatedEvent;
import com.flagship.reconciliation_engine.event.DocumentEvent;
import com.flagship.reconciliation_engine.event.DocumentTransitionedEvent;
import com.flagship.reconciliation_engine.event.WorkflowEventService;
import com.flagship.reconciliation_engine.exception.DependencyUnavailableException;
import com.flagship.reconciliation_engine.exception.DocumentLockedException;
import com.flagship.reconciliation_engine.exception.DuplicateDocumentException;
import com.flagship.reconciliation_engine.exception.InvalidTransitionException;
import com.flagship.reconciliation_engine.exception.ValidationException;
import com.flagship.reconciliation_engine.ledger.LedgerBalanceFetcher;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import com.flagship.reconciliation_engine.workflow.PostingStatus;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import com.flagship.reconciliation_engine.workflow.TransitionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Service-level behaviour with persistence and the ledger mocked out: every
 * rejected request must leave the stored document untouched.
 */
class ReconciliationServiceTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    private ReconciliationPersistenceService persistenceService;
    private LedgerBalanceFetcher ledgerBalanceFetcher;
    private RecomputationOrchestrator orchestrator;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        persistenceService = mock(ReconciliationPersistenceService.class);
        ledgerBalanceFetcher = mock(LedgerBalanceFetcher.class);
        orchestrator = new RecomputationOrchestrator(new CategoryClassifier(), new Aggregator(), new BalanceEngine());
        service = new ReconciliationService(
            persistenceService,
            orchestrator,
            new ReconciliationWorkflow(),
            new SourceRecordValidator(Validation.buildDefaultValidatorFactory().getValidator()),
            ledgerBalanceFetcher,
            mock(WorkflowEventService.class),
            new EngineMetrics(new SimpleMeterRegistry()));

        when(persistenceService.insert(any(), anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(persistenceService.update(any(), anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    private ReconciliationDocument stored(ReconciliationStatus status) {
        ReconciliationDocument document = orchestrator.recompute(ReconciliationDocument.create(
                "ACME", "1010", MARCH, new BigDecimal("4800.00"), new BigDecimal("5000.00"), null, "preparer"))
            .toBuilder().status(status).version(0L).build();
        when(persistenceService.findById(document.getId())).thenReturn(Optional.of(document));
        return document;
    }

    private static RawSourceRecord item(String amount, String descriptor) {
        return RawSourceRecord.builder()
            .amount(amount)
            .timestamp(Instant.parse("2024-03-31T00:00:00Z"))
            .descriptor(descriptor)
            .origin(SourceOrigin.MANUAL_ADJUSTMENT)
            .build();
    }

    @Test
    @DisplayName("Create stores a recomputed draft with a created event")
    @SuppressWarnings("unchecked")
    void createStoresDraft() {
        ReconciliationDocument created = service.create(
            "ACME", "1010", MARCH, new BigDecimal("4800.00"), new BigDecimal("5000.00"), null, "preparer");

        assertEquals(ReconciliationStatus.DRAFT, created.getStatus());
        assertTrue(created.isRecomputed());
        assertEquals("2023-2024", created.getFiscalYear());

        ArgumentCaptor<List<DocumentEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).insert(any(), events.capture());
        assertInstanceOf(DocumentCreatedEvent.class, events.getValue().get(0));
    }

    @Test
    @DisplayName("Second reconciliation for the same account and month is rejected")
    void duplicateRejected() {
        when(persistenceService.exists("ACME", "1010", MARCH)).thenReturn(true);

        assertThrows(DuplicateDocumentException.class, () -> service.create(
            "ACME", "1010", MARCH, null, new BigDecimal("5000.00"), null, "preparer"));
        verify(persistenceService, never()).insert(any(), anyList());
    }

    @Test
    @DisplayName("Sub-cent closing balance is rejected before anything is stored")
    void createValidation() {
        ValidationException e = assertThrows(ValidationException.class, () -> service.create(
            "ACME", " ", MARCH, null, new BigDecimal("5000.001"), null, "preparer"));

        assertTrue(e.getDetails().containsKey("accountRef"));
        assertTrue(e.getDetails().containsKey("closingBankBalance"));
        verify(persistenceService, never()).insert(any(), anyList());
    }

    @Test
    @DisplayName("Adjustments are classified and the summary recomputed")
    void addAdjustments() {
        ReconciliationDocument document = stored(ReconciliationStatus.DRAFT);

        ReconciliationDocument saved = service.addAdjustments(document.getId(), List.of(
            item("360.50", "Deposits in transit"),
            item("75.25", "Cheque 1045 outstanding")));

        assertEquals(2, saved.getAdjustments().size());
        assertEquals(new BigDecimal("5285.25"), saved.getSummary().getBalances().getAdjustedBankBalance());
        assertFalse(saved.isReconciled());
    }

    @Test
    @DisplayName("Negative adjustment is rejected and nothing is saved")
    void negativeAdjustmentRejected() {
        ReconciliationDocument document = stored(ReconciliationStatus.DRAFT);

        ValidationException e = assertThrows(ValidationException.class, () -> service.addAdjustments(
            document.getId(), List.of(item("100.00", "Deposit"), item("-5.00", "Bank charges"))));

        assertTrue(e.getDetails().containsKey("records[1].amount"));
        verify(persistenceService, never()).update(any(), anyList());
    }

    @Test
    @DisplayName("Completed reconciliation can no longer be edited")
    void lockedAfterCompletion() {
        ReconciliationDocument document = stored(ReconciliationStatus.COMPLETED);

        assertThrows(DocumentLockedException.class,
            () -> service.addAdjustments(document.getId(), List.of(item("10.00", "Bank charges"))));
        verify(persistenceService, never()).update(any(), anyList());
    }

    @Test
    @DisplayName("Ledger balance is fetched as of the end of the period")
    void refreshLedgerBalance() {
        ReconciliationDocument document = stored(ReconciliationStatus.IN_PROGRESS);
        when(ledgerBalanceFetcher.fetchLedgerBalance("1010", LocalDate.of(2024, 3, 31)))
            .thenReturn(new BigDecimal("5000.00"));

        ReconciliationDocument saved = service.refreshLedgerBalance(document.getId());

        assertEquals(new BigDecimal("5000.00"), saved.getClosingLedgerBalance());
        assertNotNull(saved.getLedgerBalanceFetchedAt());
        assertTrue(saved.isReconciled());
    }

    @Test
    @DisplayName("Ledger outage leaves the stored document as it was")
    void ledgerOutage() {
        ReconciliationDocument document = stored(ReconciliationStatus.IN_PROGRESS);
        when(ledgerBalanceFetcher.fetchLedgerBalance(any(), any()))
            .thenThrow(new DependencyUnavailableException("Ledger did not answer"));

        assertThrows(DependencyUnavailableException.class, () -> service.refreshLedgerBalance(document.getId()));
        verify(persistenceService, never()).update(any(), anyList());
    }

    @Test
    @DisplayName("Unreconciled document cannot be completed")
    void completeRejected() {
        ReconciliationDocument document = stored(ReconciliationStatus.IN_PROGRESS);

        assertThrows(InvalidTransitionException.class, () -> service.transition(
            TransitionRequest.<ReconciliationStatus>builder()
                .documentId(document.getId())
                .requestedStatus(ReconciliationStatus.COMPLETED)
                .actorId("preparer")
                .build()));
        verify(persistenceService, never()).update(any(), anyList());
    }

    @Test
    @DisplayName("Allowed transition stamps the actor and records an event")
    @SuppressWarnings("unchecked")
    void transitionRecorded() {
        ReconciliationDocument document = stored(ReconciliationStatus.DRAFT);

        TransitionResult<ReconciliationStatus> result = service.transition(
            TransitionRequest.<ReconciliationStatus>builder()
                .documentId(document.getId())
                .requestedStatus(ReconciliationStatus.IN_PROGRESS)
                .actorId("preparer")
                .build());

        assertEquals(ReconciliationStatus.DRAFT, result.getPreviousStatus());
        assertEquals(ReconciliationStatus.IN_PROGRESS, result.getNewStatus());
        assertEquals(PostingStatus.NOT_REQUESTED, result.getSideEffectOutcome().getStatus());

        ArgumentCaptor<ReconciliationDocument> saved = ArgumentCaptor.forClass(ReconciliationDocument.class);
        ArgumentCaptor<List<DocumentEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).update(saved.capture(), events.capture());
        assertEquals(ReconciliationStatus.IN_PROGRESS, saved.getValue().getStatus());
        assertEquals("preparer", saved.getValue().getHistory().get(1).getActorId());
        assertEquals("prepare", saved.getValue().getHistory().get(1).getAction());
        assertInstanceOf(DocumentTransitionedEvent.class, events.getValue().get(0));
    }
}
