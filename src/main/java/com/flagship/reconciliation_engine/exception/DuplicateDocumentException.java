package com.flagship.reconciliation_engine.exception;

import java.util.Map;

/**
 * A document already exists for the requested identity (account/period or company/filing/period).
 */
public class DuplicateDocumentException extends EngineException {

    public DuplicateDocumentException(String message, Map<String, String> identity) {
        super(ErrorCode.DUPLICATE_DOCUMENT, message, identity);
    }
}
