package com.flagship.reconciliation_engine.exception;

import java.util.Map;

/**
 * A source record (or batch) was malformed and was rejected before classification.
 * The document the records were meant for is left untouched.
 */
public class ValidationException extends EngineException {

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(ErrorCode.VALIDATION_FAILED, message, fieldErrors);
    }

    public ValidationException(String message) {
        this(message, Map.of());
    }
}
