package com.flagship.reconciliation_engine.filing;

public enum FilingType {
    /** Monthly withholding-tax statement. */
    WHT_STATEMENT
}
