package com.flagship.reconciliation_engine.reconciliation;

public enum MatchStatus {
    UNMATCHED,
    MATCHED,
    PARTIALLY_MATCHED,
    EXCLUDED
}
