package com.flagship.reconciliation_engine.exception;

/**
 * Totals no longer equal the sum of their buckets after a recomputation.
 *
 * This is a programming error, not a business condition: it is never caught
 * inside the engine.
 */
public class RoundingInvariantViolation extends IllegalStateException {

    public RoundingInvariantViolation(String message) {
        super(message);
    }
}
