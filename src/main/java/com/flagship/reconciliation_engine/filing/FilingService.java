package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.FiscalYear;
import com.flagship.reconciliation_engine.common.RawSourceRecord;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.common.SourceRecordValidator;
import com.flagship.reconciliation_engine.event.DocumentCreatedEvent;
import com.flagship.reconciliation_engine.event.DocumentEvent;
import com.flagship.reconciliation_engine.event.DocumentTransitionedEvent;
import com.flagship.reconciliation_engine.event.DocumentType;
import com.flagship.reconciliation_engine.event.LedgerPostingRecordedEvent;
import com.flagship.reconciliation_engine.event.WorkflowEvent;
import com.flagship.reconciliation_engine.event.WorkflowEventService;
import com.flagship.reconciliation_engine.exception.DocumentLockedException;
import com.flagship.reconciliation_engine.exception.DuplicateDocumentException;
import com.flagship.reconciliation_engine.exception.ValidationException;
import com.flagship.reconciliation_engine.ledger.LedgerPostingRequest;
import com.flagship.reconciliation_engine.ledger.LedgerPostingService;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import com.flagship.reconciliation_engine.workflow.PaymentMetadata;
import com.flagship.reconciliation_engine.workflow.SideEffect;
import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import com.flagship.reconciliation_engine.workflow.TransitionDecision;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import com.flagship.reconciliation_engine.workflow.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Entry point for withholding-tax filings.
 *
 * Submitting with a payment posts the deposit to the ledger: debit
 * withholding-tax payable, credit bank. The posting is fire-and-record:
 * 1. The transition and a PENDING outcome are committed first
 * 2. The ledger is called once
 * 3. POSTED or FAILED is recorded on the filing and as an event
 * A failed posting never undoes the transition, and a filing with any
 * recorded attempt is never posted again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilingService {

    private static final String DOCUMENT_TYPE = "filing";

    private final FilingPersistenceService persistenceService;
    private final RecomputationOrchestrator orchestrator;
    private final FilingWorkflow workflow;
    private final SourceRecordValidator recordValidator;
    private final LedgerPostingService ledgerPostingService;
    private final WorkflowEventService eventService;
    private final EngineMetrics metrics;

    @Value("${engine.ledger.wht-payable-account:2310}")
    private String whtPayableAccount;

    @Value("${engine.ledger.default-bank-account:1010}")
    private String defaultBankAccount;

    /**
     * Opens the monthly WHT statement for a company.
     *
     * @throws DuplicateDocumentException if the month already has one
     */
    public FilingDocument createWhtStatement(String companyId, int year, int month, String actorId) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (companyId == null || companyId.isBlank()) {
            errors.put("companyId", "must not be blank");
        }
        if (actorId == null || actorId.isBlank()) {
            errors.put("actorId", "must not be blank");
        }
        FilingPeriod period = null;
        try {
            period = FilingPeriod.of(year, month);
        } catch (IllegalArgumentException e) {
            errors.put("period", e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid filing", errors);
        }

        if (persistenceService.exists(companyId, FilingType.WHT_STATEMENT, period)) {
            throw new DuplicateDocumentException(
                String.format("WHT statement already exists for %s", period),
                Map.of("companyId", companyId, "filingType", FilingType.WHT_STATEMENT.name(),
                    "period", period.toString()));
        }

        FilingDocument document = orchestrator.recompute(
            FilingDocument.create(companyId, FilingType.WHT_STATEMENT, period, actorId));
        FilingDocument saved = persistenceService.insert(document, List.of(DocumentCreatedEvent.of(
            DocumentType.FILING, document.getId(), companyId, FilingType.WHT_STATEMENT + "/" + period, actorId)));

        metrics.recordDocumentCreated(DOCUMENT_TYPE);
        log.info("Created WHT statement {} for {} period {}, due {}", saved.getId(), companyId, period, period.dueDate());
        return saved;
    }

    public FilingDocument addVendorPayments(UUID filingId, List<RawSourceRecord> payments) {
        List<SourceRecord> records = validateWithholding(payments);
        return mutate(filingId, "add_vendor_payments", doc -> doc.addRecords(records));
    }

    /**
     * Adds payroll income-tax deductions. Records without a tag are filed
     * under salary.
     */
    public FilingDocument addPayrollDeductions(UUID filingId, List<RawSourceRecord> deductions) {
        List<SourceRecord> records = validateWithholding(deductions).stream()
            .map(r -> r.hasCategoryTag() ? r : r.toBuilder().categoryTag(WhtSection.SALARY.key()).build())
            .toList();
        return mutate(filingId, "add_payroll_deductions", doc -> doc.addRecords(records));
    }

    public FilingDocument removeRecord(UUID filingId, UUID recordId) {
        return mutate(filingId, "remove_record", doc -> doc.removeRecord(recordId));
    }

    public TransitionResult<FilingStatus> transition(TransitionRequest<FilingStatus> request) {
        MDC.put("documentId", String.valueOf(request.getDocumentId()));
        try {
            FilingDocument document = get(request.getDocumentId());
            TransitionDecision<FilingStatus> decision = workflow.decide(document, request);
            if (!decision.isAllowed()) {
                metrics.recordTransitionRejected(DOCUMENT_TYPE, String.valueOf(request.getRequestedStatus()));
                log.warn("Rejected transition {} -> {}: {}", decision.getFrom(), decision.getTo(), decision.getReason());
                decision.orThrow();
            }

            Instant now = Instant.now();
            FilingStatus target = decision.getTo();
            FilingDocument moved = applySubmissionMetadata(
                document.transitionTo(target, request.getActorId(), now), request, now);

            SideEffectOutcome reported = SideEffectOutcome.notRequested();
            boolean post = false;
            if (decision.getSideEffect() == SideEffect.POST_WHT_DEPOSIT) {
                if (document.getPostingOutcome().isAttempted()) {
                    reported = document.getPostingOutcome().skipped();
                    log.info("Deposit posting already attempted ({}), not posting again",
                        document.getPostingOutcome().getStatus());
                } else {
                    moved = moved.withPostingOutcome(
                        SideEffectOutcome.pending(document.getPeriod().depositReference(), now));
                    post = true;
                }
            }

            DocumentEvent transitioned = DocumentTransitionedEvent.of(DocumentType.FILING, document.getId(),
                decision.getFrom(), target, target.action(), request.getActorId(), now);
            FilingDocument saved = persistenceService.update(orchestrator.recompute(moved), List.of(transitioned));
            metrics.recordTransition(DOCUMENT_TYPE, target.name());
            log.info("Filing moved {} -> {} by {}", decision.getFrom(), target, request.getActorId());

            if (post) {
                reported = postDeposit(saved, request.getPayment());
            }
            return new TransitionResult<>(document.getId(), decision.getFrom(), target, reported);
        } finally {
            MDC.remove("documentId");
        }
    }

    public FilingDocument get(UUID filingId) {
        return persistenceService.findById(filingId)
            .orElseThrow(() -> new IllegalArgumentException("Filing not found: " + filingId));
    }

    /**
     * WHT statements of a fiscal year, earliest month first.
     */
    public List<FilingDocument> listByFiscalYear(String companyId, FiscalYear fiscalYear) {
        return persistenceService.findByFiscalYear(companyId, FilingType.WHT_STATEMENT, fiscalYear);
    }

    public List<WorkflowEvent> history(UUID filingId) {
        return eventService.history(DocumentType.FILING, filingId);
    }

    /**
     * Calls the ledger once and records whatever happened. Never throws for a
     * ledger failure: the transition has already been committed.
     */
    private SideEffectOutcome postDeposit(FilingDocument filing, PaymentMetadata payment) {
        SideEffectOutcome pending = filing.getPostingOutcome();
        String bankAccount = payment.getBankAccountRef() != null && !payment.getBankAccountRef().isBlank()
            ? payment.getBankAccountRef()
            : defaultBankAccount;
        String description = "WHT deposit for " + filing.getPeriod()
            + (payment.getCprNumber() != null ? " CPR " + payment.getCprNumber() : "");

        LedgerPostingRequest request = new LedgerPostingRequest(
            pending.getLedgerReference(),
            payment.getPaymentDate(),
            description,
            List.of(
                LedgerPostingRequest.Line.debit(whtPayableAccount, payment.getAmount(), "WHT payable settled"),
                LedgerPostingRequest.Line.credit(bankAccount, payment.getAmount(), "WHT deposited")
            )
        );

        SideEffectOutcome outcome;
        try {
            UUID transactionId = ledgerPostingService.post(request);
            outcome = pending.posted(transactionId);
            log.info("Posted WHT deposit {} as ledger transaction {}", pending.getLedgerReference(), transactionId);
        } catch (RuntimeException e) {
            outcome = pending.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("WHT deposit posting {} failed: {}", pending.getLedgerReference(), outcome.getFailureReason());
        }

        try {
            persistenceService.recordPostingOutcome(filing.getId(), outcome,
                LedgerPostingRecordedEvent.of(DocumentType.FILING, filing.getId(), outcome, payment.getAmount()));
        } catch (RuntimeException e) {
            // The PENDING marker stays; it still blocks a second attempt.
            log.error("Could not record posting outcome {} for filing {}: {}",
                outcome.getStatus(), filing.getId(), e.getMessage());
        }
        return outcome;
    }

    private FilingDocument applySubmissionMetadata(FilingDocument moved, TransitionRequest<FilingStatus> request,
                                                   Instant now) {
        if (moved.getStatus() == FilingStatus.SUBMITTED) {
            return moved.withSubmission(SubmissionMetadata.builder()
                .submittedAt(now)
                .submittedBy(request.getActorId())
                .payment(request.getPayment())
                .build());
        }
        if (moved.getStatus() == FilingStatus.ACKNOWLEDGED) {
            SubmissionMetadata base = moved.getSubmission() != null
                ? moved.getSubmission()
                : SubmissionMetadata.builder().build();
            return moved.withSubmission(base.toBuilder()
                .acknowledgementNumber(request.getAcknowledgementNumber().trim())
                .acknowledgedAt(now)
                .build());
        }
        return moved;
    }

    private FilingDocument mutate(UUID filingId, String operation, UnaryOperator<FilingDocument> change) {
        long startTime = System.currentTimeMillis();
        MDC.put("documentId", String.valueOf(filingId));
        try {
            FilingDocument document = get(filingId);
            if (!workflow.isEditable(document.getStatus())) {
                throw new DocumentLockedException(filingId, document.getStatus());
            }
            FilingDocument recomputed = orchestrator.recompute(change.apply(document));
            metrics.recordRecompute(DOCUMENT_TYPE, System.currentTimeMillis() - startTime);

            FilingDocument saved = persistenceService.update(recomputed, List.of());
            log.info("Filing {}: records={}, gross={}, withheld={}", operation, saved.getRecords().size(),
                saved.getSummary().getTotals().getGrossAmount(), saved.getSummary().getTotals().getWithheldAmount());
            return saved;
        } finally {
            MDC.remove("documentId");
        }
    }

    private List<SourceRecord> validateWithholding(List<RawSourceRecord> raws) {
        List<SourceRecord> records;
        try {
            records = recordValidator.validateAll(raws);
        } catch (ValidationException e) {
            metrics.incrementRecordsRejected();
            throw e;
        }

        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getWithheldAmount() == null) {
                errors.put("records[" + i + "].withheldAmount", "Withheld amount is required");
            }
        }
        if (!errors.isEmpty()) {
            metrics.incrementRecordsRejected();
            throw new ValidationException("Withholding record validation failed", errors);
        }
        return new ArrayList<>(records);
    }
}
