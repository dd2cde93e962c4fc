package com.flagship.reconciliation_engine.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a reconciliation or filing is opened.
 */
@Value
public class DocumentCreatedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    DocumentType documentType;
    String companyId;
    /** Account and period, or filing type and period. */
    String identity;
    String actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DocumentCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DocumentCreatedEvent of(DocumentType type, UUID documentId, String companyId,
                                          String identity, String actorId) {
        return new DocumentCreatedEvent(UUID.randomUUID(), documentId, type, companyId, identity, actorId, Instant.now());
    }
}
