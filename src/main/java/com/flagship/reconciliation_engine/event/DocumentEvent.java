package com.flagship.reconciliation_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for document events.
 *
 * Events are facts: they describe something that already happened to a
 * document and are written in the same transaction as the change.
 */
public interface DocumentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    UUID getDocumentId();

    DocumentType getDocumentType();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
