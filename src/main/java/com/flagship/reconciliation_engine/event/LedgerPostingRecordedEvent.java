package com.flagship.reconciliation_engine.event;

import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once the outcome of a deposit posting is known, success or failure.
 * A failed posting is surfaced here rather than by undoing the transition.
 */
@Value
public class LedgerPostingRecordedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    DocumentType documentType;
    String ledgerReference;
    String status;
    UUID ledgerTransactionId;
    BigDecimal amount;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerPostingRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerPostingRecordedEvent of(DocumentType type, UUID documentId,
                                                SideEffectOutcome outcome, BigDecimal amount) {
        return new LedgerPostingRecordedEvent(UUID.randomUUID(), documentId, type,
            outcome.getLedgerReference(), outcome.getStatus().name(), outcome.getLedgerTransactionId(),
            amount, outcome.getFailureReason(), Instant.now());
    }
}
