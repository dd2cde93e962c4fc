package com.flagship.reconciliation_engine.exception;

/**
 * An external collaborator (the ledger) could not be reached or did not answer in time.
 * Callers must surface this; substituting a default value is never correct.
 */
public class DependencyUnavailableException extends EngineException {

    public DependencyUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, message, cause);
    }

    public DependencyUnavailableException(String message) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, message, (Throwable) null);
    }
}
