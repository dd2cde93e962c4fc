package com.flagship.reconciliation_engine.reconciliation;

/**
 * Lifecycle of a bank reconciliation. APPROVED is terminal.
 */
public enum ReconciliationStatus {
    DRAFT("create"),
    IN_PROGRESS("prepare"),
    COMPLETED("review"),
    APPROVED("approve");

    private final String action;

    ReconciliationStatus(String action) {
        this.action = action;
    }

    /** Verb recorded in the workflow history when a document enters this status. */
    public String action() {
        return action;
    }
}
