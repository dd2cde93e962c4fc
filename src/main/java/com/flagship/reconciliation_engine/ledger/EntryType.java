package com.flagship.reconciliation_engine.ledger;

/**
 * Side of a ledger entry. Every posted transaction has balanced debits and credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
