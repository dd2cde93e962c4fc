package com.flagship.reconciliation_engine.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a document moves to a new workflow status.
 *
 * Together these events form the audit trail of who did what to a document.
 */
@Value
public class DocumentTransitionedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    DocumentType documentType;
    String fromStatus;
    String toStatus;
    String action;
    String actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DocumentTransitioned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DocumentTransitionedEvent of(DocumentType type, UUID documentId, Enum<?> from, Enum<?> to,
                                               String action, String actorId, Instant at) {
        return new DocumentTransitionedEvent(UUID.randomUUID(), documentId, type,
            from.name(), to.name(), action, actorId, at);
    }
}
