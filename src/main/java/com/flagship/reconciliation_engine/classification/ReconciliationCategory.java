package com.flagship.reconciliation_engine.classification;

/**
 * Reconciling-item categories of the bank reconciliation schema.
 */
public enum ReconciliationCategory implements CategoryKey {
    /** Recorded in the ledger, not yet on the bank statement. */
    DEPOSITS_IN_TRANSIT("deposits_in_transit"),
    /** Paid in the ledger, not yet cleared by the bank. */
    OUTSTANDING_CHECKS("outstanding_checks"),
    BANK_CHARGES("bank_charges"),
    INTEREST_EARNED("interest_earned"),
    /** NSF / returned checks. */
    RETURNED_CHECKS("returned_checks"),
    /** Bank or ledger errors; also the catch-all. */
    ERRORS("errors");

    private final String key;

    ReconciliationCategory(String key) {
        this.key = key;
    }

    @Override
    public String key() {
        return key;
    }
}
