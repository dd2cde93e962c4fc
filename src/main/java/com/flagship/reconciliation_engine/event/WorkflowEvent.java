package com.flagship.reconciliation_engine.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored document event awaiting (or past) publication.
 *
 * Written atomically with the document change, published to Kafka later by
 * {@link WorkflowEventPublisher}. Rows are kept after publication and double
 * as the document's audit history.
 */
@Value
public class WorkflowEvent {
    UUID id;
    DocumentType documentType;
    UUID documentId;
    String eventType;
    /** JSON payload */
    String payload;
    Instant createdAt;
    /** null if not yet published */
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static WorkflowEvent create(DocumentType documentType, UUID documentId, String eventType, String payload) {
        return new WorkflowEvent(
            UUID.randomUUID(),
            documentType,
            documentId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
