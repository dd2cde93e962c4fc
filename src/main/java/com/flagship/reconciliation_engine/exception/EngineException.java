package com.flagship.reconciliation_engine.exception;

import java.util.Map;

/**
 * Base type for the structured, recoverable errors the engine reports.
 *
 * Each subclass maps to one {@link ErrorCode}. Details carry the offending
 * fields or states so the caller can render its own message.
 */
public abstract class EngineException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    protected EngineException(ErrorCode errorCode, String message, Map<String, String> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    protected EngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
