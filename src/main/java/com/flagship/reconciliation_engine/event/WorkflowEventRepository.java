package com.flagship.reconciliation_engine.event;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowEventRepository extends JpaRepository<WorkflowEventEntity, UUID> {

    /**
     * Next batch for the publisher. Skips rows another publisher instance holds
     * and events that have used up their retries.
     */
    @Query(value = """
        SELECT * FROM workflow_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<WorkflowEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit,
                                                             @Param("maxRetries") int maxRetries);

    List<WorkflowEventEntity> findByDocumentTypeAndDocumentIdOrderBySequenceNumberAsc(
        DocumentType documentType, UUID documentId);

    @Query("SELECT COUNT(e) FROM WorkflowEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("SELECT COUNT(e) FROM WorkflowEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries")
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("SELECT MIN(e.createdAt) FROM WorkflowEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
