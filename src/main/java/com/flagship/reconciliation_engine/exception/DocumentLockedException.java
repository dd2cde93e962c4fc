package com.flagship.reconciliation_engine.exception;

import java.util.Map;
import java.util.UUID;

/**
 * Source data was edited on a document whose status no longer accepts edits.
 */
public class DocumentLockedException extends EngineException {

    public DocumentLockedException(UUID documentId, Enum<?> status) {
        super(ErrorCode.DOCUMENT_LOCKED,
            String.format("Document %s is %s and can no longer be edited", documentId, status),
            Map.of("documentId", String.valueOf(documentId), "status", String.valueOf(status)));
    }
}
