package com.flagship.reconciliation_engine.common;

/**
 * Where a source record was ingested from.
 */
public enum SourceOrigin {
    BANK_STATEMENT_LINE,
    LEDGER_ENTRY,
    VENDOR_PAYMENT,
    PAYROLL_RUN,
    MANUAL_ADJUSTMENT
}
