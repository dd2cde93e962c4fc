package com.flagship.reconciliation_engine.event;

import com.flagship.reconciliation_engine.config.JsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes document events to the workflow event log and serves them back.
 *
 * {@link #record} joins the caller's transaction: if the document change
 * commits, its event is guaranteed to be stored, and if it rolls back the
 * event goes with it. Publication happens later in {@link WorkflowEventPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventService {

    private final WorkflowEventRepository repository;
    private final JsonCodec jsonCodec;

    /**
     * Must be called within an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WorkflowEvent record(DocumentEvent event) {
        WorkflowEvent stored = WorkflowEvent.create(
            event.getDocumentType(), event.getDocumentId(), event.getEventType(), jsonCodec.write(event));

        WorkflowEventEntity saved = repository.save(WorkflowEventEntity.fromDomain(stored));

        log.debug("Recorded workflow event: type={}, documentType={}, documentId={}",
                event.getEventType(), event.getDocumentType(), event.getDocumentId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<WorkflowEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(WorkflowEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Everything that happened to a document, oldest first.
     */
    @Transactional(readOnly = true)
    public List<WorkflowEvent> history(DocumentType documentType, UUID documentId) {
        return repository.findByDocumentTypeAndDocumentIdOrderBySequenceNumberAsc(documentType, documentId)
                .stream()
                .map(WorkflowEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }
}
