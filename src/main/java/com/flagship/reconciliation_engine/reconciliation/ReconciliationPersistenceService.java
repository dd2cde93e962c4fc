package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.config.JsonCodec;
import com.flagship.reconciliation_engine.event.DocumentEvent;
import com.flagship.reconciliation_engine.event.WorkflowEventService;
import com.flagship.reconciliation_engine.recompute.RecomputationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link ReconciliationDocument} and {@link ReconciliationEntity}.
 *
 * Documents leave this service recomputed. Saving writes the document and its
 * events in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationPersistenceService {

    private final ReconciliationRepository repository;
    private final RecomputationOrchestrator orchestrator;
    private final WorkflowEventService eventService;
    private final JsonCodec jsonCodec;

    @Transactional
    public ReconciliationDocument insert(ReconciliationDocument document, List<DocumentEvent> events) {
        ReconciliationEntity saved = repository.saveAndFlush(ReconciliationEntity.fromDomain(document, jsonCodec));
        events.forEach(eventService::record);
        log.debug("Saved reconciliation {}", saved.getId());
        return load(saved);
    }

    /**
     * Writes the document if nobody changed it since it was read.
     *
     * @throws ObjectOptimisticLockingFailureException if the stored version moved on
     */
    @Transactional
    public ReconciliationDocument update(ReconciliationDocument document, List<DocumentEvent> events) {
        ReconciliationEntity existing = repository.findById(document.getId())
            .orElseThrow(() -> new IllegalArgumentException("Reconciliation not found: " + document.getId()));

        if (!Objects.equals(existing.getVersion(), document.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ReconciliationEntity.class, document.getId());
        }

        existing.updateFromDomain(document, jsonCodec);
        ReconciliationEntity updated = repository.saveAndFlush(existing);
        events.forEach(eventService::record);
        log.debug("Updated reconciliation {} to version {}", updated.getId(), updated.getVersion());
        return load(updated);
    }

    @Transactional(readOnly = true)
    public Optional<ReconciliationDocument> findById(UUID id) {
        return repository.findById(id).map(this::load);
    }

    @Transactional(readOnly = true)
    public boolean exists(String companyId, String accountRef, YearMonth period) {
        return repository.existsByCompanyIdAndAccountRefAndPeriod(companyId, accountRef, period.toString());
    }

    @Transactional(readOnly = true)
    public List<ReconciliationDocument> findByAccount(String companyId, String accountRef) {
        return repository.findByCompanyIdAndAccountRefOrderByPeriodDesc(companyId, accountRef).stream()
            .map(this::load)
            .toList();
    }

    private ReconciliationDocument load(ReconciliationEntity entity) {
        return orchestrator.recompute(entity.toDomain(jsonCodec));
    }
}
