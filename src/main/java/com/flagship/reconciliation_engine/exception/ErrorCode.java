package com.flagship.reconciliation_engine.exception;

/**
 * Machine-readable error variants returned to callers of the engine.
 */
public enum ErrorCode {
    VALIDATION_FAILED,
    INVALID_TRANSITION,
    DEPENDENCY_UNAVAILABLE,
    DOCUMENT_LOCKED,
    DUPLICATE_DOCUMENT
}
