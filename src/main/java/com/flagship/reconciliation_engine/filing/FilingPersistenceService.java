package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.common.FiscalYear;
import com.flagship.reconciliation_engine.config.JsonCodec;
import com.flagship.reconciliation_engine.event.DocumentEvent;
import com.flagship.reconciliation_engine.event.WorkflowEventService;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link FilingDocument} and {@link FilingEntity}. Documents leave
 * this service recomputed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilingPersistenceService {

    private final FilingRepository repository;
    private final RecomputationOrchestrator orchestrator;
    private final WorkflowEventService eventService;
    private final JsonCodec jsonCodec;

    @Transactional
    public FilingDocument insert(FilingDocument document, List<DocumentEvent> events) {
        FilingEntity saved = repository.saveAndFlush(FilingEntity.fromDomain(document, jsonCodec));
        events.forEach(eventService::record);
        log.debug("Saved filing {}", saved.getId());
        return load(saved);
    }

    /**
     * @throws ObjectOptimisticLockingFailureException if the stored version moved on
     */
    @Transactional
    public FilingDocument update(FilingDocument document, List<DocumentEvent> events) {
        FilingEntity existing = findEntity(document.getId());

        if (!Objects.equals(existing.getVersion(), document.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(FilingEntity.class, document.getId());
        }

        existing.updateFromDomain(document, jsonCodec);
        FilingEntity updated = repository.saveAndFlush(existing);
        events.forEach(eventService::record);
        log.debug("Updated filing {} to version {}", updated.getId(), updated.getVersion());
        return load(updated);
    }

    /**
     * Stores the result of a ledger posting on the latest version of the filing.
     */
    @Transactional
    public FilingDocument recordPostingOutcome(UUID filingId, SideEffectOutcome outcome, DocumentEvent event) {
        FilingEntity existing = findEntity(filingId);
        existing.updatePostingOutcome(outcome, jsonCodec);
        FilingEntity updated = repository.saveAndFlush(existing);
        eventService.record(event);
        return load(updated);
    }

    @Transactional(readOnly = true)
    public Optional<FilingDocument> findById(UUID id) {
        return repository.findById(id).map(this::load);
    }

    @Transactional(readOnly = true)
    public boolean exists(String companyId, FilingType filingType, FilingPeriod period) {
        return repository.existsByCompanyIdAndFilingTypeAndPeriodYearAndPeriodMonth(
            companyId, filingType, period.getYear(), period.getMonth());
    }

    @Transactional(readOnly = true)
    public List<FilingDocument> findByFiscalYear(String companyId, FilingType filingType, FiscalYear fiscalYear) {
        return repository.findByCompanyIdAndFilingTypeAndFiscalYearOrderByPeriodYearAscPeriodMonthAsc(
                companyId, filingType, fiscalYear.label()).stream()
            .map(this::load)
            .toList();
    }

    private FilingEntity findEntity(UUID id) {
        return repository.findById(id)
            .orElseThrow(() -> new IllegalArgumentException("Filing not found: " + id));
    }

    private FilingDocument load(FilingEntity entity) {
        return orchestrator.recompute(entity.toDomain(jsonCodec));
    }
}
