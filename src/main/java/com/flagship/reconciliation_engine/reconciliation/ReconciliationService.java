package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.common.RawSourceRecord;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.common.SourceRecordValidator;
import com.flagship.reconciliation_engine.event.DocumentCreatedEvent;
import com.flagship.reconciliation_engine.event.DocumentEvent;
import com.flagship.reconciliation_engine.event.DocumentTransitionedEvent;
import com.flagship.reconciliation_engine.event.DocumentType;
import com.flagship.reconciliation_engine.event.WorkflowEvent;
import com.flagship.reconciliation_engine.event.WorkflowEventService;
import com.flagship.reconciliation_engine.exception.DocumentLockedException;
import com.flagship.reconciliation_engine.exception.DuplicateDocumentException;
import com.flagship.reconciliation_engine.exception.InvalidTransitionException;
import com.flagship.reconciliation_engine.exception.ValidationException;
import com.flagship.reconciliation_engine.ledger.LedgerBalanceFetcher;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import com.flagship.reconciliation_engine.workflow.TransitionDecision;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import com.flagship.reconciliation_engine.workflow.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Entry point for bank reconciliations: ingestion of statement lines and
 * reconciling items, ledger balance refresh and workflow transitions.
 *
 * Every mutation follows the same path: validate input, load, check the
 * document is still editable, apply, recompute in full, save. A rejected
 * request leaves the stored document exactly as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private static final String DOCUMENT_TYPE = "reconciliation";

    private final ReconciliationPersistenceService persistenceService;
    private final RecomputationOrchestrator orchestrator;
    private final ReconciliationWorkflow workflow;
    private final SourceRecordValidator recordValidator;
    private final LedgerBalanceFetcher ledgerBalanceFetcher;
    private final WorkflowEventService eventService;
    private final EngineMetrics metrics;

    /**
     * Opens a reconciliation in DRAFT.
     *
     * @throws DuplicateDocumentException if the account already has one for the period
     */
    public ReconciliationDocument create(String companyId, String accountRef, YearMonth period,
                                         BigDecimal openingBankBalance, BigDecimal closingBankBalance,
                                         BigDecimal openingLedgerBalance, String actorId) {
        Map<String, String> errors = new LinkedHashMap<>();
        requireText(errors, "companyId", companyId);
        requireText(errors, "accountRef", accountRef);
        requireText(errors, "actorId", actorId);
        if (period == null) {
            errors.put("period", "must not be null");
        }
        requireAmount(errors, "closingBankBalance", closingBankBalance, true);
        requireAmount(errors, "openingBankBalance", openingBankBalance, false);
        requireAmount(errors, "openingLedgerBalance", openingLedgerBalance, false);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid reconciliation", errors);
        }

        if (persistenceService.exists(companyId, accountRef, period)) {
            throw new DuplicateDocumentException(
                String.format("Reconciliation already exists for account %s and period %s", accountRef, period),
                Map.of("companyId", companyId, "accountRef", accountRef, "period", period.toString()));
        }

        ReconciliationDocument document = orchestrator.recompute(ReconciliationDocument.create(
            companyId, accountRef, period, openingBankBalance, closingBankBalance, openingLedgerBalance, actorId));

        ReconciliationDocument saved = persistenceService.insert(document, List.of(DocumentCreatedEvent.of(
            DocumentType.RECONCILIATION, document.getId(), companyId, accountRef + "/" + period, actorId)));
        metrics.recordDocumentCreated(DOCUMENT_TYPE);
        log.info("Created reconciliation {} for account {} period {}", saved.getId(), accountRef, period);
        return saved;
    }

    public ReconciliationDocument addStatementLines(UUID documentId, List<RawSourceRecord> lines) {
        List<SourceRecord> records = validate(lines);
        return mutate(documentId, "add_statement_lines", doc ->
            doc.addStatementLines(records.stream().map(StatementLine::unmatched).toList()));
    }

    public ReconciliationDocument removeStatementLine(UUID documentId, UUID lineId) {
        return mutate(documentId, "remove_statement_line", doc -> doc.removeStatementLine(lineId));
    }

    public ReconciliationDocument updateStatementLineMatch(UUID documentId, UUID lineId, MatchStatus matchStatus,
                                                           String matchedReference, String remarks) {
        if (matchStatus == null) {
            throw new ValidationException("Match status is required", Map.of("matchStatus", "must not be null"));
        }
        return mutate(documentId, "match_statement_line", doc -> doc.updateStatementLine(lineId, line ->
            line.toBuilder().matchStatus(matchStatus).matchedReference(matchedReference).remarks(remarks).build()));
    }

    /**
     * Adds reconciling items. Amounts are magnitudes; the category decides
     * which side of the reconciliation they adjust.
     */
    public ReconciliationDocument addAdjustments(UUID documentId, List<RawSourceRecord> entries) {
        List<SourceRecord> records = validate(entries);
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            if (!Amounts.isPositive(records.get(i).getAmount())) {
                errors.put("records[" + i + "].amount", "Adjustment amount must be positive");
            }
        }
        if (!errors.isEmpty()) {
            metrics.incrementRecordsRejected();
            throw new ValidationException("Adjustment validation failed", errors);
        }
        return mutate(documentId, "add_adjustments", doc ->
            doc.addAdjustments(records.stream().map(AdjustmentEntry::unposted).toList()));
    }

    public ReconciliationDocument removeAdjustment(UUID documentId, UUID entryId) {
        return mutate(documentId, "remove_adjustment", doc -> doc.removeAdjustment(entryId));
    }

    /**
     * Marks an item as booked in the ledger. It stops adjusting the ledger side
     * from the next recomputation on.
     */
    public ReconciliationDocument markAdjustmentPosted(UUID documentId, UUID entryId, String journalReference) {
        return mutate(documentId, "mark_adjustment_posted",
            doc -> doc.updateAdjustment(entryId, entry -> entry.markPosted(journalReference)));
    }

    public ReconciliationDocument updateClosingBankBalance(UUID documentId, BigDecimal closingBankBalance) {
        Map<String, String> errors = new LinkedHashMap<>();
        requireAmount(errors, "closingBankBalance", closingBankBalance, true);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid closing bank balance", errors);
        }
        return mutate(documentId, "update_closing_bank_balance", doc -> doc.withClosingBankBalance(closingBankBalance));
    }

    public ReconciliationDocument updateNotes(UUID documentId, String notes) {
        return mutate(documentId, "update_notes", doc -> doc.withNotes(notes));
    }

    /**
     * Reads the closing ledger balance as of the last day of the period.
     *
     * @throws com.flagship.reconciliation_engine.exception.DependencyUnavailableException
     *         if the ledger cannot answer; the document keeps its previous balance
     */
    public ReconciliationDocument refreshLedgerBalance(UUID documentId) {
        ReconciliationDocument current = getEditable(documentId);
        BigDecimal balance = ledgerBalanceFetcher.fetchLedgerBalance(current.getAccountRef(), current.cutoffDate());
        return mutate(documentId, "refresh_ledger_balance",
            doc -> doc.withClosingLedgerBalance(balance, Instant.now()));
    }

    /**
     * Applies a workflow transition.
     *
     * @throws InvalidTransitionException if the lifecycle or a guard forbids it
     */
    public TransitionResult<ReconciliationStatus> transition(TransitionRequest<ReconciliationStatus> request) {
        MDC.put("documentId", String.valueOf(request.getDocumentId()));
        try {
            ReconciliationDocument document = get(request.getDocumentId());
            TransitionDecision<ReconciliationStatus> decision = workflow.decide(document, request);
            if (!decision.isAllowed()) {
                metrics.recordTransitionRejected(DOCUMENT_TYPE, String.valueOf(request.getRequestedStatus()));
                log.warn("Rejected transition {} -> {}: {}", decision.getFrom(), decision.getTo(), decision.getReason());
                decision.orThrow();
            }

            Instant now = Instant.now();
            ReconciliationStatus target = decision.getTo();
            ReconciliationDocument moved = document.transitionTo(target, request.getActorId(), now);
            DocumentEvent event = DocumentTransitionedEvent.of(DocumentType.RECONCILIATION, document.getId(),
                decision.getFrom(), target, target.action(), request.getActorId(), now);

            persistenceService.update(moved, List.of(event));
            metrics.recordTransition(DOCUMENT_TYPE, target.name());
            log.info("Reconciliation moved {} -> {} by {}", decision.getFrom(), target, request.getActorId());

            return new TransitionResult<>(document.getId(), decision.getFrom(), target, SideEffectOutcome.notRequested());
        } finally {
            MDC.remove("documentId");
        }
    }

    public ReconciliationDocument get(UUID documentId) {
        return persistenceService.findById(documentId)
            .orElseThrow(() -> new IllegalArgumentException("Reconciliation not found: " + documentId));
    }

    public List<ReconciliationDocument> listByAccount(String companyId, String accountRef) {
        return persistenceService.findByAccount(companyId, accountRef);
    }

    public List<WorkflowEvent> history(UUID documentId) {
        return eventService.history(DocumentType.RECONCILIATION, documentId);
    }

    private ReconciliationDocument mutate(UUID documentId, String operation,
                                          UnaryOperator<ReconciliationDocument> change) {
        long startTime = System.currentTimeMillis();
        MDC.put("documentId", String.valueOf(documentId));
        try {
            ReconciliationDocument document = getEditable(documentId);
            ReconciliationDocument recomputed = orchestrator.recompute(change.apply(document));
            metrics.recordRecompute(DOCUMENT_TYPE, System.currentTimeMillis() - startTime);

            ReconciliationDocument saved = persistenceService.update(recomputed, List.of());
            log.info("Reconciliation {}: adjustments={}, lines={}, variance={}, reconciled={}",
                operation, saved.getAdjustments().size(), saved.getStatementLines().size(),
                saved.getSummary().getBalances().getVariance(), saved.isReconciled());
            return saved;
        } finally {
            MDC.remove("documentId");
        }
    }

    private ReconciliationDocument getEditable(UUID documentId) {
        ReconciliationDocument document = get(documentId);
        if (!workflow.isEditable(document.getStatus())) {
            throw new DocumentLockedException(documentId, document.getStatus());
        }
        return document;
    }

    private List<SourceRecord> validate(List<RawSourceRecord> raws) {
        try {
            return recordValidator.validateAll(raws);
        } catch (ValidationException e) {
            metrics.incrementRecordsRejected();
            throw e;
        }
    }

    private static void requireText(Map<String, String> errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.put(field, "must not be blank");
        }
    }

    private static void requireAmount(Map<String, String> errors, String field, BigDecimal value, boolean required) {
        if (value == null) {
            if (required) {
                errors.put(field, "must not be null");
            }
        } else if (!Amounts.hasCentPrecision(value)) {
            errors.put(field, "must have at most 2 decimal places");
        }
    }
}
