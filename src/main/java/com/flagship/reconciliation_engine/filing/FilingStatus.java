package com.flagship.reconciliation_engine.filing;

/**
 * Lifecycle of a tax filing.
 *
 * <pre>
 * DRAFT -> PREPARED -> REVIEWED -> SUBMITTED -> ACKNOWLEDGED
 *                                      |             |
 *                                      +--> AMENDED <+
 * </pre>
 */
public enum FilingStatus {
    DRAFT("create"),
    PREPARED("prepare"),
    REVIEWED("review"),
    SUBMITTED("submit"),
    ACKNOWLEDGED("acknowledge"),
    AMENDED("amend");

    private final String action;

    FilingStatus(String action) {
        this.action = action;
    }

    public String action() {
        return action;
    }
}
