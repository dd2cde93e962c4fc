package com.flagship.reconciliation_engine.workflow;

public enum PostingStatus {
    NOT_REQUESTED,
    /** Recorded before the ledger is called; a crash leaves it here and it is never retried. */
    PENDING,
    POSTED,
    FAILED,
    SKIPPED_ALREADY_ATTEMPTED
}
