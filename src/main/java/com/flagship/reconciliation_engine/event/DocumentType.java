package com.flagship.reconciliation_engine.event;

/**
 * Aggregate types that emit workflow events. The name is stored with each event.
 */
public enum DocumentType {
    RECONCILIATION,
    FILING
}
